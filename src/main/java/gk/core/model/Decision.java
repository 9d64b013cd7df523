package gk.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
