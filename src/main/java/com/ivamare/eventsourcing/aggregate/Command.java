package com.ivamare.eventsourcing.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ivamare.eventsourcing.authorization.Principal;
import com.ivamare.eventsourcing.model.ValidationReport;

/**
 * A request to change the state of an aggregate of type {@code T}.
 *
 * <p>Subclasses carry their arguments as Jackson-serializable properties and need a no-arg
 * constructor so that scheduled commands can be stored and read back.
 *
 * @param <T> target aggregate type
 */
public abstract class Command<T extends EventSourcedAggregate> {

    private String etag;

    private Long appliesToVersion;

    @JsonIgnore
    private Principal principal;

    /**
     * Name the command is registered and stored under.
     */
    public String commandName() {
        return getClass().getSimpleName();
    }

    /**
     * Rules that depend only on the command's own arguments.
     */
    public ValidationReport validate() {
        return ValidationReport.valid();
    }

    /**
     * Rules that depend on the current state of the target.
     */
    public ValidationReport validateAgainst(T target) {
        return ValidationReport.valid();
    }

    /**
     * Idempotency token. A command whose etag is already present in the target's history is not
     * applied again.
     */
    public String getEtag() {
        return etag;
    }

    public void setEtag(String etag) {
        this.etag = etag;
    }

    /**
     * When set, the command is only applied while the target is exactly at this version.
     */
    public Long getAppliesToVersion() {
        return appliesToVersion;
    }

    public void setAppliesToVersion(Long appliesToVersion) {
        this.appliesToVersion = appliesToVersion;
    }

    @JsonIgnore
    public Principal getPrincipal() {
        return principal;
    }

    @JsonIgnore
    public void setPrincipal(Principal principal) {
        this.principal = principal;
    }

    @Override
    public String toString() {
        return commandName() + (etag != null ? "(etag=" + etag + ")" : "");
    }
}
