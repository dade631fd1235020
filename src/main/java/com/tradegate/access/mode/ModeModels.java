package com.tradegate.access.mode;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

public class ModeModels {

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ModeSwitched.class, name = "ModeSwitched"),
            @JsonSubTypes.Type(value = ModeSwitchRejected.class, name = "ModeSwitchRejected")
    })
    public sealed interface ModeSwitchResult permits ModeSwitched, ModeSwitchRejected {
        TradingMode mode();
    }

    /** {@code changed} is false when the user was already in the requested mode. */
    public record ModeSwitched(TradingMode mode, boolean changed) implements ModeSwitchResult {}

    /** The user stays in {@code mode}; switching to live requires the live-trading permission. */
    public record ModeSwitchRejected(TradingMode mode, TradingMode requested, String missingPermission) implements ModeSwitchResult {}

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Proceed.class, name = "Proceed"),
            @JsonSubTypes.Type(value = Redirect.class, name = "Redirect")
    })
    public sealed interface RouteDecision permits Proceed, Redirect {}

    public record Proceed() implements RouteDecision {}

    public record Redirect(String target) implements RouteDecision {}
}
