package com.progmail.template;

import com.progmail.markup.MarkupNode;
import com.progmail.markup.MarkupTree;
import com.progmail.util.RunLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateEngineTest {

    private RunLog log;
    private MarkupTree tree;
    private TemplateEngine engine;

    @BeforeEach
    public void setup() {
        log = new RunLog();
        tree = new MarkupTree(log);

        AttributeTable table = new AttributeTable();
        table.add(AttributeRecord.builder()
                .put("full name", "Ann").put("track", "Tech").put("pronouns", "").put("note", "[[schedule]]")
                .build());
        table.add(AttributeRecord.builder().put("full name", "Bob").put("track", "Arts").put("badge", "Bobby").build());
        engine = new TemplateEngine(table, log);
    }

    private MarkupNode person(String markup) {
        return tree.parse("<person>" + markup + "</person>").getChild(0);
    }

    private String render(String body, OutputFormat format, MarkupNode person) {
        RenderResult result = engine.render(new TemplateBody(body, format), person);
        assertTrue(result.isRendered(), "render failed: " + result);
        return result.getText();
    }

    @Test
    public void testScheduleWithNoItems() {
        MarkupNode ann = person("<full name>Ann</full name><email>ann@x.com</email>");
        assertEquals("", render("[[schedule]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testScheduleTitleOnly() {
        MarkupNode ann = person("<full name>Ann</full name><item><title>TITLE</title></item>");
        assertEquals("TITLE\n\n\n", render("[[schedule]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testScheduleAllFields() {
        MarkupNode ann = person("<full name>Ann</full name>"
                + "<item><precis>About it</precis><title>Panel</title><equipment>Mic</equipment>"
                + "<participants>Ann, Bob</participants></item>"
                + "<item><title>Signing</title><participants>Ann</participants></item>");
        assertEquals("Panel\nAnn, Bob\nMic\nAbout it\n\nSigning\nAnn\n\n",
                render("[[SCHEDULE]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testScheduleHtml() {
        MarkupNode ann = person("<full name>Ann</full name>"
                + "<item><title>Panel</title><participants>Ann</participants><precis>Talk</precis></item>"
                + "<item></item>");
        assertEquals("<p>Panel</p>\n<p>Ann</p>\n<p>Talk</p>\n<p></p>\n"
                        + "<p></p>\n<p></p>\n<p></p>\n",
                render("[[schedule]]", OutputFormat.HTML, ann));
    }

    @Test
    public void testPlainColumns() {
        MarkupNode ann = person("<full name>Ann</full name>");
        assertEquals("Dear Ann, you are in Tech.",
                render("Dear [[full name]], you are in [[ Track ]].", OutputFormat.PLAIN_TEXT, ann));
        assertEquals("Ann", render("[[FullName]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testDecoratedColumn() {
        MarkupNode ann = person("<full name>Ann</full name>");
        assertEquals("Hello, Ann!", render("[[Hello, |full name|!]]", OutputFormat.PLAIN_TEXT, ann));
        assertEquals("Hi Ann", render("Hi Ann[[ (|pronouns|)]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testColumnOnlyInOtherRowsIsEmpty() {
        MarkupNode ann = person("<full name>Ann</full name>");
        assertEquals("Badge: ", render("Badge: [[badge]]", OutputFormat.PLAIN_TEXT, ann));
        assertEquals("", render("[[Badge: |badge|]]", OutputFormat.PLAIN_TEXT, ann));

        MarkupNode bob = person("<full name>Bob</full name>");
        assertEquals("Badge: Bobby", render("[[Badge: |badge|]]", OutputFormat.PLAIN_TEXT, bob));
    }

    @Test
    public void testUnknownColumnFails() {
        MarkupNode ann = person("<full name>Ann</full name>");
        RenderResult result = engine.render(new TemplateBody("Size [[shoe size]]", OutputFormat.PLAIN_TEXT), ann);
        assertFalse(result.isRendered());
        assertEquals("shoe size", result.getMissingColumn());
        assertNull(result.getText());

        RenderResult decorated = engine.render(new TemplateBody("[[a|nope|b]]", OutputFormat.PLAIN_TEXT), ann);
        assertEquals("nope", decorated.getMissingColumn());
    }

    @Test
    public void testSubstitutionsAreNotRescanned() {
        MarkupNode ann = person("<full name>Ann</full name><item><title>T</title></item>");
        assertEquals("[[schedule]]", render("[[note]]", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testUnterminatedPlaceholderIsCopied() {
        MarkupNode ann = person("<full name>Ann</full name>");
        assertEquals("Dear Ann [[oops", render("Dear [[full name]] [[oops", OutputFormat.PLAIN_TEXT, ann));
        assertEquals("", render("", OutputFormat.PLAIN_TEXT, ann));
    }

    @Test
    public void testOutputFormatFromMailFormat() {
        assertEquals(OutputFormat.HTML, OutputFormat.fromMailFormat(" HTML "));
        assertEquals(OutputFormat.PLAIN_TEXT, OutputFormat.fromMailFormat("text"));
        assertEquals(OutputFormat.PLAIN_TEXT, OutputFormat.fromMailFormat(null));
    }
}
