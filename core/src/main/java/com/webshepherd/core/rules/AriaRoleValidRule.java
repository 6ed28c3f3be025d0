package com.webshepherd.core.rules;

import com.webshepherd.core.document.HtmlDocument;
import com.webshepherd.core.document.HtmlElement;
import com.webshepherd.core.model.Finding;
import com.webshepherd.core.model.Principle;
import com.webshepherd.core.model.Severity;
import com.webshepherd.core.model.WcagLevel;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/** 4.1.2 Name, Role, Value: role 값은 ARIA 1.2 화이트리스트 안에 있어야 한다. */
public final class AriaRoleValidRule extends AbstractRule {

    public static final String CODE = "ARIA_ROLE_INVALID";

    static final Set<String> VALID_ROLES = Set.of(
            "alert", "alertdialog", "application", "article", "banner", "button",
            "checkbox", "columnheader", "combobox", "complementary", "contentinfo",
            "definition", "dialog", "directory", "document", "feed", "figure",
            "form", "grid", "gridcell", "group", "heading", "img", "link", "list",
            "listbox", "listitem", "log", "main", "marquee", "math", "menu",
            "menubar", "menuitem", "menuitemcheckbox", "menuitemradio", "navigation",
            "none", "note", "option", "presentation", "progressbar", "radio",
            "radiogroup", "region", "row", "rowgroup", "rowheader", "scrollbar",
            "search", "searchbox", "separator", "slider", "spinbutton", "status",
            "switch", "tab", "table", "tablist", "tabpanel", "term", "textbox",
            "timer", "toolbar", "tooltip", "tree", "treegrid", "treeitem");

    public AriaRoleValidRule() {
        super(CODE, "4.1.2", WcagLevel.AA, Principle.ROBUST);
    }

    @Override
    public List<Finding> evaluate(HtmlDocument doc) {
        List<HtmlElement> withRole = doc.elementsWithAttribute("role");
        int invalid = 0;
        String first = null;
        StringJoiner names = new StringJoiner(", ");
        for (HtmlElement e : withRole) {
            String role = e.attr("role").orElse("").trim().toLowerCase(Locale.ROOT);
            if (role.isEmpty() || VALID_ROLES.contains(role)) continue;
            if (invalid == 0) first = e.snippet();
            if (invalid < 5) names.add("'" + role + "'");
            invalid++;
        }

        if (invalid > 0) {
            return List.of(finding(Severity.FAIL,
                    invalid + " invalid ARIA roles found: " + names,
                    "Use only valid ARIA 1.2 role values",
                    first, invalid));
        }
        if (!withRole.isEmpty()) {
            return List.of(pass("All " + withRole.size() + " ARIA roles are valid"));
        }
        return List.of(finding(Severity.PASS, "No ARIA roles found", "N/A - No roles to check"));
    }
}
