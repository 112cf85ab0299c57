package io.sigv4;

import io.sigv4.auth.AwsRequestSigner;
import com.amazonaws.auth.BasicAWSCredentials;
import org.apache.hadoop.conf.Configuration;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

public class SignerFactory {

    public static AwsRequestSigner newSigner(String profile, Configuration conf) throws IOException {
        String accessKey = SignerConfiguration.get(conf, profile, Constants.ACCESS_KEY_KEY_SUFFIX);
        if (accessKey == null) {
            throw new IOException("Missing AWS access key");
        }
        String secretKey = SignerConfiguration.get(conf, profile, Constants.SECRET_KEY_KEY_SUFFIX);
        if (secretKey == null) {
            throw new IOException("Missing AWS secret key");
        }
        // a positive offset means the local clock runs ahead of the service
        int timeOffset = SignerConfiguration.getInt(conf, profile, Constants.TIME_OFFSET_SECONDS_KEY_SUFFIX, 0);
        Clock clock = Clock.systemUTC();
        if (timeOffset != 0) {
            clock = Clock.offset(clock, Duration.ofSeconds(-timeOffset));
        }
        try {
            return new AwsRequestSigner(new BasicAWSCredentials(accessKey, secretKey), clock);
        } catch (IllegalArgumentException e) {
            throw new IOException(String.format("Invalid AWS credentials for profile %s: %s", profile, e.getMessage()), e);
        }
    }
}
