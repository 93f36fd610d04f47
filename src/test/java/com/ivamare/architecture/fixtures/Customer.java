package com.ivamare.architecture.fixtures;

import com.ivamare.architecture.entity.AbstractEntity;

public class Customer extends AbstractEntity<String> {

    private String name;

    private Customer() {
    }

    public Customer(String id, String name) {
        super(id);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void rename(String name) {
        this.name = name;
        markModified();
    }
}
