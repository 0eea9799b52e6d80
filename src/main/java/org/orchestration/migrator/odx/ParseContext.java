package org.orchestration.migrator.odx;

/**
 * One parsing scope with its own sequence counter: the service body, a Decide
 * branch, a Switch case, a Listen branch or a Construct's inner block.
 * The path names the scope inside the orchestration and feeds the node unique ids.
 */
public final class ParseContext {
    private final String path;
    private int nextSequence;

    private ParseContext(String path) {
        this.path = path;
    }

    public static ParseContext root(String name) {
        return new ParseContext(name);
    }

    /**
     * A fresh context nested below this one, counting from zero again.
     */
    public ParseContext isolated(String segment) {
        return new ParseContext(path + "/" + segment);
    }

    public int nextSequence() {
        return nextSequence++;
    }

    public String path() {
        return path;
    }
}
