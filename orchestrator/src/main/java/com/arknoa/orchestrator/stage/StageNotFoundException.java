package com.arknoa.orchestrator.stage;

public class StageNotFoundException extends ConfigurationException {
    public StageNotFoundException(String name) {
        super("No stage registered with name: '" + name + "'");
    }
}
