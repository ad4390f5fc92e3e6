package com.legal.reasoner.api;

public record NodeRef(String id) implements EntityRef {

    public NodeRef {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.NODE;
    }

    @Override
    public String toString() {
        return id;
    }
}
