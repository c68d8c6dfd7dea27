package com.progmail.assembler;

import com.progmail.template.SelectionCriterion;
import com.progmail.template.TemplateBody;

/**
 * A parsed template file: who gets a message, what it says, and optionally
 * where the batch is written.
 */
public final class EmailTemplate {

    private final SelectionCriterion selection;
    private final TemplateBody body;
    private final String outputFileName;

    public EmailTemplate(SelectionCriterion selection, TemplateBody body, String outputFileName) {
        this.selection = selection;
        this.body = body;
        this.outputFileName = outputFileName;
    }

    public SelectionCriterion getSelection() {
        return selection;
    }

    public TemplateBody getBody() {
        return body;
    }

    /**
     * @return the output file named by {@code <inputFileName>}, or null
     */
    public String getOutputFileName() {
        return outputFileName;
    }
}
