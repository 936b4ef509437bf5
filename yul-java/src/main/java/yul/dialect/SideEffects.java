package yul.dialect;

/**
 * Side-effect summary of a builtin. Only carried along for later passes; the analyzer ignores it.
 */
public record SideEffects(
        boolean movable,
        boolean canBeRemoved,
        Effect storage,
        Effect memory,
        Effect otherState
) {
    public enum Effect { NONE, READ, WRITE }

    public static final SideEffects PURE =
            new SideEffects(true, true, Effect.NONE, Effect.NONE, Effect.NONE);
    public static final SideEffects READS_STATE =
            new SideEffects(false, true, Effect.NONE, Effect.NONE, Effect.READ);
    public static final SideEffects READS_STORAGE =
            new SideEffects(false, true, Effect.READ, Effect.NONE, Effect.NONE);
    public static final SideEffects READS_MEMORY =
            new SideEffects(false, true, Effect.NONE, Effect.READ, Effect.NONE);
    public static final SideEffects WRITES_STORAGE =
            new SideEffects(false, false, Effect.WRITE, Effect.NONE, Effect.NONE);
    public static final SideEffects WRITES_MEMORY =
            new SideEffects(false, false, Effect.NONE, Effect.WRITE, Effect.NONE);
    public static final SideEffects LOGS =
            new SideEffects(false, false, Effect.NONE, Effect.READ, Effect.WRITE);
    public static final SideEffects WORLD =
            new SideEffects(false, false, Effect.WRITE, Effect.WRITE, Effect.WRITE);

    public static SideEffects worst() {
        return WORLD;
    }
}
