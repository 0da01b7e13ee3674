package com.contractlink.harvester.harvest.model;

public record ContractKey(String state, String solicitationNumber) {
    @Override
    public String toString() {
        return state + ":" + solicitationNumber;
    }
}
