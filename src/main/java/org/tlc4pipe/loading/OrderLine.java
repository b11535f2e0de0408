package org.tlc4pipe.loading;

import java.util.Objects;

public final class OrderLine {

    final PipeType pipeType;
    final int      quantity;

    public OrderLine(PipeType pipeType, int quantity) {
        this.pipeType = Objects.requireNonNull(pipeType, "pipeType");
        if (quantity < 1) throw new IllegalArgumentException("Cantidad debe ser >= 1 para " + pipeType.code + ": " + quantity);
        this.quantity = quantity;
    }

    public PipeType pipeType() { return pipeType; }
    public int quantity()      { return quantity; }

    @Override public String toString() {
        return pipeType.code + " x" + quantity;
    }
}
