package com.progmail.assembler;

import com.progmail.markup.BracketExtractor;
import com.progmail.markup.BracketedText;
import com.progmail.template.NormalizedKeyMap;
import com.progmail.template.OutputFormat;
import com.progmail.template.SelectionCriterion;
import com.progmail.template.TemplateBody;
import com.progmail.util.RunLog;

/**
 * Splits a template document into its selection and email body.
 *
 * <pre>
 * &lt;select&gt;&lt;header&gt;track&lt;/header&gt;&lt;value&gt;Tech&lt;/value&gt;&lt;/select&gt;
 * &lt;email body&gt;Dear [[full name]], ...&lt;/email body&gt;
 * &lt;inputFileName&gt;optional output file&lt;/inputFileName&gt;
 * </pre>
 * The select block comes first; the other two may follow in either order.
 */
public class EmailTemplateParser {

    static final String SELECT = "select";
    static final String HEADER = "header";
    static final String VALUE = "value";
    static final String EMAIL_BODY = "email body";
    static final String OUTPUT_FILE_NAME = "inputFileName";

    private final RunLog log;

    public EmailTemplateParser(RunLog log) {
        this.log = log;
    }

    public EmailTemplate parse(String template, OutputFormat format) throws AssemblyException {
        BracketedText select = BracketExtractor.extractNext(template);
        if (!is(select, SELECT)) {
            throw malformed("First item in template is not the selection: tag='" + select.getTag() + "'");
        }

        BracketedText header = BracketExtractor.extractNext(select.getContent());
        if (!is(header, HEADER)) {
            throw malformed("First item in the select block is not the header: tag='" + header.getTag() + "'");
        }
        BracketedText value = BracketExtractor.extractNext(header.getTrailing());
        if (!is(value, VALUE)) {
            throw malformed("Second item in the select block is not the selection value: tag='"
                    + value.getTag() + "'");
        }
        SelectionCriterion selection = new SelectionCriterion(header.getContent(), value.getContent());

        String body = null;
        String outputFileName = null;
        String rest = select.getTrailing();
        while (!rest.isEmpty()) {
            BracketedText item = BracketExtractor.extractNext(rest);
            if (!item.isFound()) {
                break;
            }
            rest = item.getTrailing();

            if (is(item, EMAIL_BODY)) {
                if (body != null) {
                    log.warn("Template has more than one <" + EMAIL_BODY + ">; the first one is used.");
                } else {
                    body = item.getContent();
                }
            } else if (is(item, OUTPUT_FILE_NAME)) {
                outputFileName = item.getContent().trim();
            } else {
                log.warn("Ignoring unrecognized template item <" + item.getTag() + ">");
            }
        }

        if (body == null) {
            throw malformed("Template has no <" + EMAIL_BODY + "> after the selection");
        }

        log.info("Selecting people with " + selection);
        return new EmailTemplate(selection, new TemplateBody(body, format),
                outputFileName == null || outputFileName.isEmpty() ? null : outputFileName);
    }

    private static boolean is(BracketedText text, String tag) {
        return text.isFound() && NormalizedKeyMap.normalize(text.getTag()).equals(NormalizedKeyMap.normalize(tag));
    }

    private AssemblyException malformed(String message) {
        log.fatal(message);
        return new AssemblyException(ExitStatus.MALFORMED_TEMPLATE, message);
    }
}
