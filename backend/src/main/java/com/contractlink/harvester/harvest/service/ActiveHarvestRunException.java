package com.contractlink.harvester.harvest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveHarvestRunException extends RuntimeException {
    public ActiveHarvestRunException(String message) {
        super(message);
    }
}
