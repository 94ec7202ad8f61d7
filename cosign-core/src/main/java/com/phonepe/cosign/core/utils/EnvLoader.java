package com.phonepe.cosign.core.utils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

/**
 * Loads variables from a .env file (location overridable with the {@code dotenv.file} system property) or from the
 * process environment
 */
@UtilityClass
public class EnvLoader {

    private static final Dotenv DOTENV = Dotenv.configure()
            .filename(System.getProperty("dotenv.file", ".env"))
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    /**
     * Reads a variable, falling back to a default
     * @param variable     the name of the variable
     * @param defaultValue value to return if the variable is not set anywhere
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(DOTENV, variable, defaultValue);
    }

    @VisibleForTesting
    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromFile = dotenv.get(variable);
        if (!Strings.isNullOrEmpty(fromFile)) {
            return fromFile;
        }
        final var fromSystem = System.getenv(variable);
        return Strings.isNullOrEmpty(fromSystem) ? defaultValue : fromSystem;
    }
}
