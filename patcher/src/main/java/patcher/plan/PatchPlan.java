package patcher.plan;

import java.util.*;

import patcher.config.EditCatalog;
import patcher.config.MatchMode;
import patcher.exceptions.PatchException;
import patcher.rule.CallArgumentRule;
import patcher.rule.ConstructorParameterRule;
import patcher.rule.EditRule;
import patcher.rule.FieldRule;
import patcher.rule.ImportRule;
import patcher.rule.PlaceholderRule;
import patcher.rule.TargetKind;

/**
 * Immutable, ordered set of edit rules applied to every file of a run.
 *
 * <p>Plans are built using {@link #build(List)}, which validates that:
 * <ul>
 *   <li>Every rule has a non-blank identifier</li>
 *   <li>No two rules share a rule id (same kind and identifier)</li>
 * </ul>
 *
 * <p>Rules run in the order given. {@link #fromCatalog(EditCatalog, MatchMode)}
 * orders them import, placeholder, fields, constructors, call sites; since
 * their spans are disjoint the final content does not depend on that order.
 *
 * @see EditRule
 * @see patcher.engine.FileRewriter
 */
public final class PatchPlan {

    private final List<EditRule> rules;
    private final Map<String, EditRule> byId;

    private PatchPlan(List<EditRule> rules, Map<String, EditRule> byId) {
        this.rules = rules;
        this.byId = byId;
    }

    // ===== public API =====

    /**
     * Returns the rules in application order.
     *
     * @return an immutable list of rules
     */
    public List<EditRule> rules() {
        return rules;
    }

    /**
     * Gets a rule by id.
     *
     * @param id the rule id, e.g. {@code field:FXHandler}
     * @return the rule, or null if the plan has no such rule
     */
    public EditRule ruleFor(String id) {
        return byId.get(id);
    }

    /**
     * Returns the rules of one kind, in application order.
     */
    public List<EditRule> rulesOf(TargetKind kind) {
        List<EditRule> result = new ArrayList<>();
        for (EditRule rule : rules) {
            if (rule.kind() == kind) result.add(rule);
        }
        return List.copyOf(result);
    }

    /** Returns true if the plan has no rules. */
    public boolean isEmpty() {
        return rules.isEmpty();
    }

    // ===== factory =====

    /**
     * Builds a plan from a list of rules.
     *
     * @param rules the rules, in application order
     * @return an immutable plan
     * @throws PatchException if an identifier is blank or a rule id is duplicated
     */
    public static PatchPlan build(List<EditRule> rules) throws PatchException {
        Objects.requireNonNull(rules, "rules");

        Map<String, EditRule> byId = new LinkedHashMap<>();
        for (EditRule rule : rules) {
            String identifier = rule.identifier();
            if (identifier == null || identifier.isBlank()) {
                throw new PatchException("Blank identifier for " + rule.kind().label() + " rule");
            }
            if (byId.containsKey(rule.id())) {
                throw new PatchException("Duplicate rule", null, rule.id(), "plan", null);
            }
            byId.put(rule.id(), rule);
        }

        return new PatchPlan(List.copyOf(rules), Collections.unmodifiableMap(byId));
    }

    /**
     * Builds the plan described by a target catalog.
     *
     * @param catalog the target catalog
     * @param matchMode how rules recognise edits that are already present
     * @return an immutable plan
     * @throws PatchException if the catalog names a target twice or has blank names
     */
    public static PatchPlan fromCatalog(EditCatalog catalog, MatchMode matchMode) throws PatchException {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(matchMode, "matchMode");

        List<EditRule> rules = new ArrayList<>();

        catalog.importEdit().ifPresent(e ->
                rules.add(new ImportRule(e.anchor(), e.entry(), matchMode)));

        catalog.placeholderEdit().ifPresent(e ->
                rules.add(new PlaceholderRule(e.marker(), e.fallback(), e.replacement())));

        catalog.fieldEdit().ifPresent(e -> {
            for (String type : e.types()) {
                rules.add(new FieldRule(type, e.fieldName(), e.declaration(), matchMode));
            }
        });

        catalog.constructorEdit().ifPresent(e -> {
            for (String type : e.types()) {
                rules.add(new ConstructorParameterRule(type, e.prefix(), e.parameter(), e.assignment(), matchMode));
            }
        });

        catalog.callEdit().ifPresent(e -> {
            for (String function : e.functions()) {
                rules.add(new CallArgumentRule(function, e.argument(), e.suppressKeywords(), matchMode));
            }
        });

        return build(rules);
    }
}
