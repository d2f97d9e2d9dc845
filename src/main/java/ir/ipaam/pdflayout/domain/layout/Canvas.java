package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.render.DrawOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Drawing operations of one page, in paint order. */
public class Canvas {

    private final List<DrawOperation> operations = new ArrayList<>();

    public void add(DrawOperation operation) {
        operations.add(operation);
    }

    /** Appends everything drawn on {@code other}, painting it over this canvas. */
    public void append(Canvas other) {
        operations.addAll(other.operations);
    }

    public List<DrawOperation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
