package org.orchestration.migrator.odx;

/**
 * Builds small ODX documents inline for tests that need one particular shape layout.
 */
public class OdxTestContent {
    private static final String HEADER = "#if __DESIGNER_DATA\n"
            + "#error Do not define __DESIGNER_DATA.\n"
            + "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
            + "<om:MetaModel xmlns:om=\"" + OdxElementReader.DESIGNER_NS + "\">\n"
            + "<om:Element Type=\"Module\" OID=\"mod\"><om:Property Name=\"Name\" Value=\"Test.Module\" />\n"
            + "<om:Element Type=\"ServiceDeclaration\" OID=\"svc\"><om:Property Name=\"Name\" Value=\"TestOrchestration\" />\n"
            + "<om:Element Type=\"ServiceBody\" OID=\"body\">\n";
    private static final String FOOTER = "</om:Element>\n</om:Element>\n</om:Element>\n</om:MetaModel>\n"
            + "#endif // __DESIGNER_DATA\n";

    /**
     * Wraps shape elements into a complete ODX file text with a single service body.
     */
    public static String odx(String... bodyElements) {
        return HEADER + String.join("\n", bodyElements) + FOOTER;
    }

    public static String property(String name, String value) {
        return "<om:Property Name=\"" + name + "\" Value=\"" + value + "\" />";
    }

    public static String element(String type, String oid, String... content) {
        String oidAttribute = oid == null ? "" : " OID=\"" + oid + "\"";
        return "<om:Element Type=\"" + type + "\"" + oidAttribute + ">" + String.join("", content) + "</om:Element>";
    }

    public static String receive(String oid, String name, boolean activate) {
        return element("Receive", oid, property("Name", name), property("Activate", activate ? "True" : "False"));
    }

    public static String send(String oid, String name) {
        return element("Send", oid, property("Name", name));
    }

    public static String branch(String oid, String name, String expression, String... shapes) {
        String expressionProperty = expression == null ? "" : property("Expression", expression);
        return element("DecisionBranch", oid, property("Name", name) + expressionProperty + String.join("", shapes));
    }

    public static String correlation(String oid, String name, String statementOid, boolean initializes) {
        return element("CorrelationDeclaration", oid, property("Name", name),
                element("StatementRef", null, property("Ref", statementOid),
                        property("Initializes", initializes ? "True" : "False")));
    }
}
