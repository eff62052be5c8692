package com.rivet.core.generator;

import java.util.Arrays;
import java.util.Optional;

/**
 * Boolean switches that change which template is used or which companion components
 * are generated.
 */
public enum Modifier {
    RESOURCE("resource"),
    API("api"),
    COLLECTION("collection"),
    MIGRATION("migration"),
    FACTORY("factory"),
    SEEDER("seeder"),
    SYNC("sync"),
    UNIT("unit"),
    INTEGRATION("integration");

    private final String flag;

    Modifier(String flag) {
        this.flag = flag;
    }

    /**
     * Returns the long flag name that turns this modifier on.
     *
     * @return flag name without dashes
     */
    public String flag() {
        return flag;
    }

    public static Optional<Modifier> fromFlag(String flag) {
        return Arrays.stream(values()).filter(modifier -> modifier.flag.equals(flag)).findFirst();
    }
}
