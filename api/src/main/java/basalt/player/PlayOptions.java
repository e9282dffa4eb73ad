package basalt.player;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Optional arguments for playing a track.
 */
public final class PlayOptions {
    private static final PlayOptions DEFAULTS = new PlayOptions(true, 0, null, null, null);

    private final boolean replace;
    private final long start;
    private final Long end;
    private final Integer volume;
    private final Boolean paused;

    private PlayOptions(boolean replace, long start, @Nullable Long end,
                        @Nullable Integer volume, @Nullable Boolean paused) {
        this.replace = replace;
        this.start = start;
        this.end = end;
        this.volume = volume;
        this.paused = paused;
    }

    @Nonnull
    @CheckReturnValue
    public static PlayOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param replace Whether the track should replace the one currently playing. Defaults to true.
     *
     * @return A copy with the new value.
     */
    @Nonnull
    @CheckReturnValue
    public PlayOptions replace(boolean replace) {
        return new PlayOptions(replace, start, end, volume, paused);
    }

    /**
     * @param start Position to start playing from, in milliseconds. Defaults to 0.
     *
     * @return A copy with the new value.
     */
    @Nonnull
    @CheckReturnValue
    public PlayOptions start(@Nonnegative long start) {
        if(start < 0) {
            throw new IllegalArgumentException("Start must not be negative");
        }
        return new PlayOptions(replace, start, end, volume, paused);
    }

    /**
     * @param end Position to stop playing at, in milliseconds, or null to play until the end.
     *
     * @return A copy with the new value.
     */
    @Nonnull
    @CheckReturnValue
    public PlayOptions end(@Nullable Long end) {
        return new PlayOptions(replace, start, end, volume, paused);
    }

    /**
     * @param volume Volume to set, clamped to [0, 1000], or null to keep the current one.
     *
     * @return A copy with the new value.
     */
    @Nonnull
    @CheckReturnValue
    public PlayOptions volume(@Nullable Integer volume) {
        return new PlayOptions(replace, start, end, volume, paused);
    }

    /**
     * @param paused True to pause, false to resume, null to keep the current paused state.
     *
     * @return A copy with the new value.
     */
    @Nonnull
    @CheckReturnValue
    public PlayOptions paused(@Nullable Boolean paused) {
        return new PlayOptions(replace, start, end, volume, paused);
    }

    @CheckReturnValue
    public boolean replace() {
        return replace;
    }

    @CheckReturnValue
    public long start() {
        return start;
    }

    @Nullable
    @CheckReturnValue
    public Long end() {
        return end;
    }

    @Nullable
    @CheckReturnValue
    public Integer volume() {
        return volume;
    }

    @Nullable
    @CheckReturnValue
    public Boolean paused() {
        return paused;
    }
}
