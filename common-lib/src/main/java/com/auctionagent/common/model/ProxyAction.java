package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProxyAction {

    ACCEPT_LOSS("accept_loss"),
    INCREASE_PROXY("increase_proxy"),
    MAINTAIN_PROXY("maintain_proxy");

    private final String wire;

    ProxyAction(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
