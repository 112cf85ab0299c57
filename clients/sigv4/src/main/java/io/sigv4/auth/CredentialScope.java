package io.sigv4.auth;

import io.sigv4.Constants;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * The date/region/service a derived signing key is valid for.
 */
public final class CredentialScope {
    static final DateTimeFormatter DATE_STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final String dateStamp;
    private final String region;
    private final String service;

    public CredentialScope(String dateStamp, String region, String service) {
        this.dateStamp = dateStamp;
        this.region = region;
        this.service = service;
    }

    public static CredentialScope of(Instant instant, String region, String service) {
        return new CredentialScope(getDateStamp(instant), region, service);
    }

    public static String getDateStamp(Instant instant) {
        return DATE_STAMP_FORMAT.format(instant);
    }

    public String getDateStamp() {
        return dateStamp;
    }

    public String getRegion() {
        return region;
    }

    public String getService() {
        return service;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialScope that = (CredentialScope) o;
        return dateStamp.equals(that.dateStamp) && region.equals(that.region) && service.equals(that.service);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dateStamp, region, service);
    }

    // date/region/service/aws4_request
    @Override
    public String toString() {
        return dateStamp + "/" + region + "/" + service + "/" + Constants.TERMINATOR;
    }
}
