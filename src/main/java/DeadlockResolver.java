import java.util.List;

/**
 * Chooses which resource to take away when a circular wait is found. Called synchronously by
 * the engine; the run does not advance until it returns.
 */
public interface DeadlockResolver {
    int chooseResourceToRelease(List<Integer> candidates);
}
