package org.tlc4pipe.loading;

import org.locationtech.jts.geom.Envelope;

public final class PlacedBundle {

    final Bundle  bundle;
    final double  centerZ;
    final double  centerY;
    final int     row;
    final boolean offsetRow;

    PlacedBundle(Bundle bundle, double centerZ, double centerY, int row, boolean offsetRow) {
        this.bundle = bundle;
        this.centerZ = centerZ;
        this.centerY = centerY;
        this.row = row;
        this.offsetRow = offsetRow;
    }

    public Bundle bundle()      { return bundle; }
    public double centerZ()     { return centerZ; }
    public double centerY()     { return centerY; }
    public int row()            { return row; }
    public boolean offsetRow()  { return offsetRow; }
    public double diameterMm()  { return bundle.footprintDiameterMm(); }

    // caja envolvente del círculo en coordenadas del camión (z, y)
    public Envelope footprint() {
        double r = diameterMm() / 2.0;
        return new Envelope(centerZ - r, centerZ + r, centerY - r, centerY + r);
    }
}
