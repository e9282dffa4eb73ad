package basalt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;

public class Version {
    private static final Logger log = LoggerFactory.getLogger(Version.class);

    public static final String VERSION;
    public static final String COMMIT;

    static {
        var props = new Properties();
        try(var in = Version.class.getResourceAsStream("/basalt/version.properties")) {
            if(in != null) {
                props.load(in);
            }
        } catch(IOException e) {
            log.warn("Unable to read version information", e);
        }
        var version = props.getProperty("version", "");
        VERSION = version.isEmpty() || version.startsWith("$") ? "0.0.0-dev" : version;
        COMMIT = props.getProperty("commit", "unknown");
    }
}
