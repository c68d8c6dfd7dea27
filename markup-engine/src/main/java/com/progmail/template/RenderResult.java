package com.progmail.template;

/**
 * Rendered email text, or the column that could not be resolved.
 */
public final class RenderResult {

    private final String text;
    private final String missingColumn;

    private RenderResult(String text, String missingColumn) {
        this.text = text;
        this.missingColumn = missingColumn;
    }

    public static RenderResult rendered(String text) {
        return new RenderResult(text, null);
    }

    public static RenderResult missingColumn(String column) {
        return new RenderResult(null, column);
    }

    public boolean isRendered() {
        return missingColumn == null;
    }

    /**
     * @return the rendered text, or null when rendering failed
     */
    public String getText() {
        return text;
    }

    /**
     * @return the unknown column name, or null when rendering succeeded
     */
    public String getMissingColumn() {
        return missingColumn;
    }

    @Override
    public String toString() {
        return isRendered() ? "RenderResult{rendered}" : "RenderResult{missingColumn='" + missingColumn + "'}";
    }
}
