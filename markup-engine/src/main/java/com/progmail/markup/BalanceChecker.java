package com.progmail.markup;

import com.progmail.util.RunLog;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Checks that every {@code <tag>} has a matching {@code </tag>} and every
 * {@code [[} a matching {@code ]]}, properly nested. Run before a document is
 * handed to {@link MarkupTree}, which silently drops what it cannot match.
 */
public class BalanceChecker {

    private static final int CONTEXT_LENGTH = 60;

    private final DelimiterScanner scanner;
    private final RunLog log;

    public BalanceChecker(RunLog log) {
        this(new DelimiterScanner(), log);
    }

    public BalanceChecker(DelimiterScanner scanner, RunLog log) {
        this.scanner = scanner;
        this.log = log;
    }

    /**
     * Check a whole document. Stops at the first violation.
     */
    public BalanceResult check(String document) {
        // Line breaks become spaces so no delimiter straddles a line
        String text = document == null ? "" : document.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        Deque<String> nesting = new ArrayDeque<>();

        while (true) {
            Delimiter next = scanner.locateNext(text);
            text = next.getRemainder();
            String token = next.getToken();

            if (next.isEnd()) {
                if (!nesting.isEmpty()) {
                    return fail(FailureReason.UNBALANCED_DELIMITERS, nesting.peek(), text);
                }
                return BalanceResult.balanced();
            }

            if (!next.isClosing()) {
                nesting.push(token);
                log.debug("BalanceChecker: push '" + token + "'");
                continue;
            }

            if (nesting.isEmpty()) {
                return fail(FailureReason.UNMATCHED_CLOSE, token, text);
            }

            String top = nesting.pop();
            log.debug("BalanceChecker: pop '" + top + "' for '" + token + "'");

            if (Delimiter.CLOSE_BRACKET.equals(token)) {
                if (!Delimiter.OPEN_BRACKET.equals(top)) {
                    return fail(FailureReason.MISMATCHED_BRACKET, token, text);
                }
            } else if (!top.equals(token.substring(1))) {
                return fail(FailureReason.MISMATCHED_TAG, token, text);
            }
        }
    }

    private BalanceResult fail(FailureReason reason, String delimiter, String remainder) {
        String context = remainder.length() > CONTEXT_LENGTH
                ? remainder.substring(0, CONTEXT_LENGTH) + "..."
                : remainder;
        BalanceResult result = BalanceResult.failure(reason, delimiter, context);
        log.debug("BalanceChecker: " + result.describe());
        return result;
    }
}
