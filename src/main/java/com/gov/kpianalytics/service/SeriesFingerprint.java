package com.gov.kpianalytics.service;

import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.Observation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over a canonical rendering of the request: kind, ids, every
 * observation in supplied order, then the configuration tokens that affect
 * the output. Equal inputs always give equal fingerprints.
 */
public final class SeriesFingerprint {

    private SeriesFingerprint() {}

    public static String of(String kind, String kpiId, String regionId, KpiSeries series, Object... configTokens) {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append('|').append(kpiId).append('|').append(regionId).append('|');
        for (Observation o : series.getObservations()) {
            sb.append(o.year()).append('Q').append(o.quarter()).append('=')
                    .append(Double.doubleToLongBits(o.value())).append(';');
        }
        for (Object token : configTokens) {
            sb.append('|').append(token);
        }
        return sha256(sb.toString());
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
