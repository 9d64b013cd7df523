package gk.java.engine;

/**
 * Address of one quota's state: the rule registration it belongs to plus
 * {@code scope:scopeValue:identifier}.
 *
 * Two rules never share state, even when their scope keys are equal. The generation changes on
 * every add or update of a rule id, so a request still holding the previous registration can
 * only create state the current registration never reads.
 */
record ScopeKey(String ruleId, long generation, String scopeKey) {

    static ScopeKey of(RegisteredRule registered, String identifier) {
        return new ScopeKey(registered.id(), registered.generation(),
            registered.rule().scope().wireName() + ":" + registered.rule().scopeValue() + ":" + identifier);
    }
}
