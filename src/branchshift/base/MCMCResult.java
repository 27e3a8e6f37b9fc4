package branchshift.base;

/**
 * What a proposal leaves behind: the log of the proposal ratio, plus whatever
 * subclasses need to restore the previous state.
 */
class MCMCResult {
    double bpp;

    MCMCResult(double bpp) {
        this.bpp = bpp;
    }
}
