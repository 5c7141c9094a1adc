package phoenixcenter.hgtindex;


import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Log4j2
public class GlobalConfig {

    private static Properties probs;

    static {
        try {
            init();
        } catch (IOException e) {
            throw new IllegalStateException("Global setting initialization error!!", e);
        }
    }

    /**
     * Initialize Properties from the hgt.properties file on the classpath
     *
     * @throws IOException
     */
    public static void init() throws IOException {
        probs = new Properties();
        try (InputStream in = GlobalConfig.class.getResourceAsStream("/hgt.properties")) {
            if (in == null) {
                throw new IOException("hgt.properties not found on classpath");
            }
            probs.load(in);
        }
        log.debug("{} default settings loaded", probs.size());
    }

    public static String getValue(String key) {
        return probs.getProperty(key);
    }

    public static int getIntValue(String key) {
        return Integer.parseInt(probs.getProperty(key).trim());
    }

    public static double getDoubleValue(String key) {
        return Double.parseDouble(probs.getProperty(key).trim());
    }
}
