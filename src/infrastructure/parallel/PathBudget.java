package infrastructure.parallel;

/**
 * Shared counter enforcing the global path cap across start-state searches.
 *
 * <h3>Admission rule</h3>
 * <p>A search is only started while the budget is not exhausted, and its paths are
 * admitted as a whole if the budget is still open when the search completes. A single
 * admission may therefore push the total past the cap (by at most one search's worth of
 * paths), matching the sequential rule "stop issuing searches once the cap is reached".
 *
 * <h3>Thread safety</h3>
 * <p>{@link #admit(int)} performs its check and increment under the instance lock, so
 * concurrent {@link StartStateSearchTask}s never admit after the cap was observed as
 * reached. {@link #isExhausted()} reads a volatile snapshot for the cheap pre-check.
 */
public final class PathBudget {

    private final int cap;
    private volatile int admitted;

    public PathBudget(int cap) {
        if (cap <= 0) {
            throw new IllegalArgumentException("cap must be positive, got: " + cap);
        }
        this.cap = cap;
    }

    /**
     * @return {@code true} once no further search should be started
     */
    public boolean isExhausted() {
        return admitted >= cap;
    }

    /**
     * Admits the paths of one completed search.
     *
     * @param count number of paths the search accepted
     * @return {@code true} if the caller should keep them
     */
    public synchronized boolean admit(int count) {
        if (admitted >= cap) return false;
        admitted += count;
        return true;
    }

    public int getAdmitted() { return admitted; }

    public int getCap() { return cap; }
}
