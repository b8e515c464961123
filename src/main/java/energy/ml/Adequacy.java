package energy.ml;

/** Outcome of the F-test on a fitted model. */
public enum Adequacy {
    ADEQUATE,
    INADEQUATE
}
