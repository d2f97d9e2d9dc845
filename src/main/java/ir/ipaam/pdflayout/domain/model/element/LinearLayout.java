package ir.ipaam.pdflayout.domain.model.element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Children stacked top to bottom. */
public final class LinearLayout implements Element {

    private final List<Element> children = new ArrayList<>();

    private LinearLayout() {
    }

    public static LinearLayout vertical() {
        return new LinearLayout();
    }

    public static LinearLayout of(List<? extends Element> children) {
        LinearLayout layout = new LinearLayout();
        layout.children.addAll(children);
        return layout;
    }

    public void push(Element element) {
        children.add(element);
    }

    public LinearLayout element(Element element) {
        push(element);
        return this;
    }

    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }
}
