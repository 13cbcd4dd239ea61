package com.explify.sidecar.config;

import com.explify.sidecar.model.OperatingMode;
import java.util.Objects;

/**
 * Process-wide operating mode, fixed at startup.
 *
 * Every component that branches on the mode receives this value through its constructor instead of
 * reading the environment itself.
 */
public final class ModeConfig {
    private final OperatingMode mode;

    private ModeConfig(OperatingMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public static ModeConfig of(OperatingMode mode) {
        return new ModeConfig(mode);
    }

    public static ModeConfig networked() {
        return new ModeConfig(OperatingMode.NETWORKED);
    }

    public static ModeConfig local() {
        return new ModeConfig(OperatingMode.LOCAL);
    }

    public OperatingMode getMode() {
        return this.mode;
    }

    public boolean isNetworked() {
        return this.mode == OperatingMode.NETWORKED;
    }

    public boolean isLocal() {
        return this.mode == OperatingMode.LOCAL;
    }

    @Override
    public String toString() {
        return "ModeConfig[" + this.mode + "]";
    }
}
