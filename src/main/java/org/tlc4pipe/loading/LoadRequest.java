package org.tlc4pipe.loading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class LoadRequest {

    /* Par código/cantidad. La cantidad se valida en el planificador, no acá. */
    public static final class Item {
        final String pipeCode;
        final int quantity;

        public Item(String pipeCode, int quantity) {
            this.pipeCode = pipeCode;
            this.quantity = quantity;
        }

        public String pipeCode() { return pipeCode; }
        public int quantity()    { return quantity; }
    }

    final List<Item> items;
    final double pipeLengthM;
    final boolean nestingEnabled;
    final int maxLevels;
    final TruckSpec truck;

    public LoadRequest(List<Item> items, double pipeLengthM, boolean nestingEnabled, int maxLevels, TruckSpec truck) {
        this.items = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(items, "items")));
        this.pipeLengthM = pipeLengthM;
        this.nestingEnabled = nestingEnabled;
        this.maxLevels = maxLevels;
        this.truck = Objects.requireNonNull(truck, "truck");
    }

    public List<Item> items()        { return items; }
    public double pipeLengthM()      { return pipeLengthM; }
    public boolean nestingEnabled()  { return nestingEnabled; }
    public int maxLevels()           { return maxLevels; }
    public TruckSpec truck()         { return truck; }
}
