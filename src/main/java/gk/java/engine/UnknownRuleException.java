package gk.java.engine;

/**
 * An update referenced a rule id that is not registered.
 */
public final class UnknownRuleException extends InvalidRuleException {

    public UnknownRuleException(String ruleId) {
        super("no rule with id '" + ruleId + "'");
    }
}
