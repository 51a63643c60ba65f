package cz.vut.fit.urlradar.models;

/**
 * The six ordered risk bands, from the safest ({@link #A}) to the most severe ({@link #F}).
 */
public enum RiskLevel {
    A("Safe"),
    B("Low risk"),
    C("Medium risk"),
    D("Elevated risk"),
    E("High risk"),
    F("Confirmed threat");

    private final String _label;

    RiskLevel(String label) {
        _label = label;
    }

    public String label() {
        return _label;
    }

    /**
     * Returns true if this level is strictly more severe than the other one.
     */
    public boolean isMoreSevereThan(RiskLevel other) {
        return this.ordinal() > other.ordinal();
    }

    /**
     * The most severe level.
     */
    public static RiskLevel mostSevere() {
        return F;
    }
}
