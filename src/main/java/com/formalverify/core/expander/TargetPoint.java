package com.formalverify.core.expander;

/**
 * Manually supplied pickup target in the expander's 2D frame.
 */
public final class TargetPoint {

    private final double x;
    private final double y;

    public TargetPoint(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public double distanceTo(double px, double py) {
        return Math.hypot(x - px, y - py);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetPoint)) return false;
        TargetPoint other = (TargetPoint) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
