package org.deepsymmetry.tagplaylists.taxonomy;

import org.apiguardian.api.API;

/**
 * How tags that the taxonomy does not mention are gathered into "Other" playlists.
 */
@API(status = API.Status.STABLE)
public enum RemainderType {

    /**
     * An "Other" folder holding one playlist for each leftover tag.
     */
    FOLDER("folder"),

    /**
     * A single "Other" playlist holding every track with a leftover tag.
     */
    PLAYLIST("playlist");

    /**
     * The value used to choose this type in configuration.
     */
    @API(status = API.Status.STABLE)
    public final String configValue;

    RemainderType(String configValue) {
        this.configValue = configValue;
    }

    /**
     * Look up a remainder type by its configuration value.
     *
     * @param configValue the configured text, such as {@code folder}
     *
     * @return the matching type, or {@code null} if there is none
     */
    @API(status = API.Status.STABLE)
    public static RemainderType forConfigValue(String configValue) {
        for (RemainderType type : values()) {
            if (type.configValue.equals(configValue)) {
                return type;
            }
        }
        return null;
    }
}
