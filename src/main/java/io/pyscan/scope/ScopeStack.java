package io.pyscan.scope;

import java.util.HashSet;
import java.util.Set;

/**
 * Chain of lexical frames, innermost first.
 * <p>
 * {@link #push()} returns a child stack and leaves the receiver untouched, so a traversal
 * passes the current stack down with each call instead of mutating a shared one.
 * {@link #define(String)} only ever writes the receiver's own frame.
 */
public final class ScopeStack {

    private final ScopeStack parent;
    private final Set<String> names = new HashSet<>();
    private final int depth;
    private final boolean comprehension;

    private ScopeStack(ScopeStack parent, boolean comprehension) {
        this.parent = parent;
        this.depth = parent == null ? 1 : parent.depth + 1;
        this.comprehension = comprehension;
    }

    /**
     * Creates a stack holding only the module frame.
     */
    public static ScopeStack global() {
        return new ScopeStack(null, false);
    }

    /**
     * Returns a new stack with an empty frame on top of this one.
     */
    public ScopeStack push() {
        return new ScopeStack(this, false);
    }

    /**
     * Like {@link #push()}, but marks the new frame as a comprehension frame.
     * Assignment expressions inside it bind in {@link #bindingFrame()} instead.
     */
    public ScopeStack pushComprehension() {
        return new ScopeStack(this, true);
    }

    /**
     * Returns the innermost frame that is not a comprehension frame.
     */
    public ScopeStack bindingFrame() {
        ScopeStack frame = this;
        while (frame.comprehension && frame.parent != null) {
            frame = frame.parent;
        }
        return frame;
    }

    /**
     * Returns the enclosing stack. The module frame is never removed: popping it returns itself.
     */
    public ScopeStack pop() {
        return parent == null ? this : parent;
    }

    /**
     * Adds a name to the innermost frame. Null and empty names are ignored.
     */
    public void define(String name) {
        if (name != null && !name.isEmpty()) {
            names.add(name);
        }
    }

    public boolean isVisible(String name) {
        for (ScopeStack frame = this; frame != null; frame = frame.parent) {
            if (frame.names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the innermost frame itself defines the name.
     */
    public boolean definesLocally(String name) {
        return names.contains(name);
    }

    public int depth() {
        return depth;
    }

    public boolean isComprehension() {
        return comprehension;
    }

    public boolean isGlobal() {
        return parent == null;
    }
}
