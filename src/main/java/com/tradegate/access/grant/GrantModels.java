package com.tradegate.access.grant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.tradegate.access.domain.DomainModels.UserPermission;
import com.tradegate.access.eligibility.EligibilityModels.FailureReason;

import java.util.List;

public class GrantModels {

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Granted.class, name = "Granted"),
            @JsonSubTypes.Type(value = AlreadyHad.class, name = "AlreadyHad"),
            @JsonSubTypes.Type(value = NotEligible.class, name = "NotEligible")
    })
    public sealed interface GrantResult permits Granted, AlreadyHad, NotEligible {
        @JsonProperty("granted")
        default boolean granted() {
            return !(this instanceof NotEligible);
        }

        @JsonProperty("alreadyHad")
        default boolean alreadyHad() {
            return this instanceof AlreadyHad;
        }
    }

    /** A new row was written by this call. */
    public record Granted(UserPermission permission) implements GrantResult {}

    /** The row existed before this call, or a concurrent caller wrote it first. */
    public record AlreadyHad(UserPermission permission) implements GrantResult {}

    public record NotEligible(String userId, String permissionId, List<FailureReason> reasons) implements GrantResult {}
}
