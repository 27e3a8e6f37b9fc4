package branchshift.base;

/**
 * The annealing exponent applied to the likelihood in the acceptance test.
 * One instance can be shared by all chains of a Metropolis-coupled ensemble;
 * the chains only read it, an outside coordinator sets it between steps.
 */
public class Coldness {

    private volatile double value;

    public Coldness() {
        this(1.0);
    }

    public Coldness(double value) {
        set(value);
    }

    public double get() {
        return value;
    }

    public void set(double value) {
        if (!(value >= 0.0 && value <= 1.0))
            throw new IllegalArgumentException("Coldness must be in [0, 1]: " + value);
        this.value = value;
    }
}
