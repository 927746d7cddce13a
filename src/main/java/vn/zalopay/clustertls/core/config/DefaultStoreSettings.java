package vn.zalopay.clustertls.core.config;

import java.nio.file.Paths;

import lombok.Builder;
import lombok.Data;

/**
 * Process-wide overrides used only when resolving the default key store and trust store.
 *
 * <p>Normally taken from the {@code javax.net.ssl.*} system properties; tests build their own.
 */
@Data
@Builder
public class DefaultStoreSettings {
    public static final String KEY_STORE_PROPERTY = "javax.net.ssl.keyStore";
    public static final String KEY_STORE_PASSWORD_PROPERTY = "javax.net.ssl.keyStorePassword";
    public static final String TRUST_STORE_PROPERTY = "javax.net.ssl.trustStore";
    public static final String TRUST_STORE_PASSWORD_PROPERTY = "javax.net.ssl.trustStorePassword";

    // Legacy keytool conventions, not secrets.
    public static final String DEFAULT_KEY_STORE_PASSWORD = "";
    public static final String DEFAULT_TRUST_STORE_PASSWORD = "changeit";

    /** Key store file. Blank means start from an empty key store. */
    private final String keyStorePath;

    private final String keyStorePassword;

    /** Trust store file. Blank means probe the security directory. */
    private final String trustStorePath;

    private final String trustStorePassword;

    /** Directory holding {@code jssecacerts} and {@code cacerts}. */
    private final String securityDirectory;

    public static DefaultStoreSettings fromSystemProperties() {
        return DefaultStoreSettings.builder()
                .keyStorePath(System.getProperty(KEY_STORE_PROPERTY, ""))
                .keyStorePassword(
                        System.getProperty(KEY_STORE_PASSWORD_PROPERTY, DEFAULT_KEY_STORE_PASSWORD))
                .trustStorePath(System.getProperty(TRUST_STORE_PROPERTY, ""))
                .trustStorePassword(
                        System.getProperty(
                                TRUST_STORE_PASSWORD_PROPERTY, DEFAULT_TRUST_STORE_PASSWORD))
                .securityDirectory(
                        Paths.get(System.getProperty("java.home"), "lib", "security").toString())
                .build();
    }

    public char[] keyStorePasswordChars() {
        return keyStorePassword == null
                ? DEFAULT_KEY_STORE_PASSWORD.toCharArray()
                : keyStorePassword.toCharArray();
    }

    public char[] trustStorePasswordChars() {
        return trustStorePassword == null
                ? DEFAULT_TRUST_STORE_PASSWORD.toCharArray()
                : trustStorePassword.toCharArray();
    }

    @Override
    public String toString() {
        return "DefaultStoreSettings{"
                + "keyStorePath='"
                + keyStorePath
                + '\''
                + ", trustStorePath='"
                + trustStorePath
                + '\''
                + ", securityDirectory='"
                + securityDirectory
                + '\''
                + '}';
    }
}
