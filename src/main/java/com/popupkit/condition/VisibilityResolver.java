package com.popupkit.condition;

import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.GroupElement;
import com.popupkit.models.OptionElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes which identifiers are currently on screen. An element is visible when its whole
 * ancestor chain is visible, its own guard holds, and (for reveals of a value-bearing owner)
 * the owner is set, or (for option children) the owning option is selected.
 */
public class VisibilityResolver {

    private final ConditionEvaluator evaluator;
    private final PopupState state;

    public VisibilityResolver(PopupDefinition definition, PopupState state) {
        this.evaluator = new ConditionEvaluator(definition, state);
        this.state = state;
    }

    public static Set<String> visibleIds(PopupDefinition definition, PopupState state) {
        Set<String> ids = new LinkedHashSet<>();
        new VisibilityResolver(definition, state).collect(definition.getElements(), ids);
        return ids;
    }

    private void collect(List<Element> elements, Set<String> ids) {
        for (Element element : elements) {
            if (element.getWhen() != null && !evaluator.evaluate(element.getWhen())) {
                continue;
            }
            if (element.getId() != null) {
                ids.add(element.getId());
            }
            if (element instanceof GroupElement) {
                collect(((GroupElement) element).getElements(), ids);
            }
            ElementValue value = element.getId() != null ? state.getValue(element.getId()) : null;
            if (element instanceof OptionElement && value != null) {
                List<String> selected = ConditionEvaluator.selectedLabels(element, value);
                for (Map.Entry<String, List<Element>> branch : ((OptionElement) element).getOptionChildren().entrySet()) {
                    if (selected.contains(branch.getKey())) {
                        collect(branch.getValue(), ids);
                    }
                }
            }
            if (!element.hasValue() || ConditionEvaluator.isTruthy(value)) {
                collect(element.getReveals(), ids);
            }
        }
    }
}
