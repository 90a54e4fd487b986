package com.popupkit.models;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared shape of the choice-bearing variants: an ordered option list and, per option
 * label, a branch of child elements shown while that option is selected.
 */
public abstract class OptionElement extends Element {
    private final List<OptionValue> options;
    private final Map<String, List<Element>> optionChildren = new LinkedHashMap<>();

    protected OptionElement(String label, List<OptionValue> options) {
        super(label);
        this.options = options != null ? new ArrayList<>(options) : new ArrayList<>();
    }

    public List<OptionValue> getOptions() { return options; }

    public Map<String, List<Element>> getOptionChildren() { return optionChildren; }

    public void putOptionChildren(String optionLabel, List<Element> children) {
        optionChildren.put(optionLabel, children != null ? new ArrayList<>(children) : new ArrayList<>());
    }

    public List<String> getOptionLabels() {
        List<String> labels = new ArrayList<>(options.size());
        for (OptionValue option : options) {
            labels.add(option.getLabel());
        }
        return labels;
    }

    /**
     * Index of the option with the given label, or -1.
     */
    public int indexOfOption(String optionLabel) {
        for (int i = 0; i < options.size(); i++) {
            if (options.get(i).getLabel().equals(optionLabel)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public List<List<Element>> getNestedLists() {
        return new ArrayList<>(optionChildren.values());
    }

    protected <T extends OptionElement> T copyOptionsInto(T target) {
        copyBaseInto(target);
        for (Map.Entry<String, List<Element>> entry : optionChildren.entrySet()) {
            target.putOptionChildren(entry.getKey(), copyAll(entry.getValue()));
        }
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        OptionElement that = (OptionElement) o;
        return options.equals(that.options) && optionChildren.equals(that.optionChildren);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseHash(), options, optionChildren);
    }
}
