package com.metbull.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MetbullSyncApplication {
    static final String DISABLE_HOSTNAME_VERIFICATION = "jdk.internal.httpclient.disableHostnameVerification";

    public static void main(String[] args) {
        relaxHostnameVerification();
        SpringApplication.run(MetbullSyncApplication.class, args);
    }

    /**
     * The JDK client reads this flag once per JVM, so it has to be set before any
     * HttpClient exists. The process only talks to the catalog host, whose
     * certificate does not match its name.
     */
    static void relaxHostnameVerification() {
        if (System.getProperty(DISABLE_HOSTNAME_VERIFICATION) == null) {
            System.setProperty(DISABLE_HOSTNAME_VERIFICATION, "true");
        }
    }
}
