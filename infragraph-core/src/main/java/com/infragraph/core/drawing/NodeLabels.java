package com.infragraph.core.drawing;

import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds readable labels such as {@code Private 2 (Subnet)} from resource ids.
 *
 * <p>The type loses its provider prefix ({@code aws_}, {@code azurerm_}, {@code google_},
 * {@code tv_aws_}) and goes through the provider's name replacements. Words on the acronym list
 * are upper-cased, other words capitalized.
 */
public class NodeLabels {

    private static final List<String> PROVIDER_PREFIXES =
        List.of("tv_aws_", "tv_azure_", "tv_gcp_", "aws_", "azurerm_", "azuread_", "google_");

    private final RuleConfiguration rules;

    public NodeLabels(RuleConfiguration rules) {
        this.rules = rules;
    }

    /**
     * Returns the label of a resource.
     *
     * @param id resource id
     * @return label
     */
    public String labelOf(String id) {
        String typeLabel = typeLabel(ResourceIds.typeOf(id));
        String name = replaced(ResourceIds.nameOf(id));
        String number = ResourceIds.numberOf(id).map(n -> " " + n).orElse("");
        if (name.isBlank()) {
            return typeLabel + number;
        }
        String nameLabel = words(name);
        if (typeLabel.isBlank() || typeLabel.equalsIgnoreCase(nameLabel)) {
            return nameLabel + number;
        }
        return nameLabel + number + " (" + typeLabel + ")";
    }

    String typeLabel(String type) {
        String local = type;
        for (String prefix : PROVIDER_PREFIXES) {
            if (local.startsWith(prefix)) {
                local = local.substring(prefix.length());
                break;
            }
        }
        String replacement = rules.nameReplacements().get(local);
        return replacement != null ? replacement : words(local);
    }

    private String replaced(String name) {
        String replacement = rules.nameReplacements().get(name);
        return replacement != null ? replacement : name;
    }

    private String words(String text) {
        if (text.contains(" ") && !text.contains("_")) {
            return text;
        }
        List<String> words = new ArrayList<>();
        for (String word : text.split("[_\\-]+")) {
            if (word.isEmpty()) {
                continue;
            }
            String lower = word.toLowerCase(Locale.ROOT);
            if (rules.acronyms().contains(lower)) {
                words.add(lower.toUpperCase(Locale.ROOT));
            } else {
                words.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
            }
        }
        return String.join(" ", words);
    }
}
