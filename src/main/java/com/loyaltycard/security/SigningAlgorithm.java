package com.loyaltycard.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

/**
 * HMAC algorithms accepted for bearer token signing.
 */
public enum SigningAlgorithm {

    HS256("HmacSHA256", Jwts.SIG.HS256),
    HS384("HmacSHA384", Jwts.SIG.HS384),
    HS512("HmacSHA512", Jwts.SIG.HS512);

    private final String jcaName;
    private final MacAlgorithm macAlgorithm;

    SigningAlgorithm(String jcaName, MacAlgorithm macAlgorithm) {
        this.jcaName = jcaName;
        this.macAlgorithm = macAlgorithm;
    }

    public String getJcaName() {
        return jcaName;
    }

    public MacAlgorithm getMacAlgorithm() {
        return macAlgorithm;
    }

    public int getMinimumKeyBytes() {
        return macAlgorithm.getKeyBitLength() / 8;
    }
}
