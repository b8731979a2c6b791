/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service;

import ch.admin.bj.swiyu.ticketproof.common.exception.MalformedSignatureException;
import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofPayload;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * The signing key of the service. One instance per process, the address is derived once and never changes.
 * <p>
 * All operations are free of side effects and may be called in parallel without limit.
 * </p>
 */
@Slf4j
public class SignerIdentity {

    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("^0x[0-9a-fA-F]{130}$");
    private static final int COMPONENT_LENGTH = 32;
    private static final int V_OFFSET = 27;

    private final Credentials credentials;
    private final ProofCodec proofCodec;
    private final String address;

    public SignerIdentity(String privateKeyHex, ProofCodec proofCodec) {
        this.credentials = Credentials.create(privateKeyHex);
        this.proofCodec = proofCodec;
        this.address = Keys.toChecksumAddress(credentials.getAddress());
    }

    /**
     * @return EIP-55 checksummed address of the signer
     */
    public String getAddress() {
        return address;
    }

    /**
     * Signs the EIP-712 digest of the payload.
     *
     * @return 65 byte signature r || s || v as 0x prefixed hex
     */
    public String sign(DomainParameters domain, ProofPayload payload) {
        var digest = proofCodec.hash(domain, payload);
        var signatureData = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
        return toHex(signatureData);
    }

    /**
     * Recovers the address which produced the signature over the payload in the given domain.
     * A signature of another key, another domain or a modified payload recovers a different address.
     *
     * @return lower case 0x prefixed address
     * @throws MalformedSignatureException if no public key can be recovered from the signature
     */
    public String recoverSigner(DomainParameters domain, ProofPayload payload, String signature) throws MalformedSignatureException {
        var signatureData = parse(signature);
        var digest = proofCodec.hash(domain, payload);
        return recover(digest, signatureData, false);
    }

    /**
     * Checks an EIP-191 personal message signature as created by wallets with personal_sign.
     *
     * @return true if the signature over the message recovers to the address, compared case-insensitively
     */
    public boolean verifyPersonalMessage(String expectedAddress, String message, String signature) {
        if (expectedAddress == null || message == null) {
            return false;
        }
        try {
            var recovered = recover(message.getBytes(StandardCharsets.UTF_8), parse(signature), true);
            return recovered.equalsIgnoreCase(expectedAddress);
        } catch (MalformedSignatureException e) {
            log.debug("Wallet signature for {} could not be recovered: {}", expectedAddress, e.getMessage());
            return false;
        }
    }

    private static String recover(byte[] data, Sign.SignatureData signatureData, boolean prefixedMessage) throws MalformedSignatureException {
        try {
            BigInteger publicKey = prefixedMessage
                    ? Sign.signedPrefixedMessageToKey(data, signatureData)
                    : Sign.signedMessageHashToKey(data, signatureData);
            return "0x" + Keys.getAddress(publicKey);
        } catch (SignatureException | RuntimeException e) {
            // r or s outside of the curve order fail inside web3j with arbitrary runtime exceptions
            throw new MalformedSignatureException("No public key can be recovered from signature", e);
        }
    }

    static Sign.SignatureData parse(String signature) throws MalformedSignatureException {
        if (signature == null || !SIGNATURE_PATTERN.matcher(signature).matches()) {
            throw new MalformedSignatureException("Signature must be 65 bytes of 0x prefixed hex");
        }
        var bytes = Numeric.hexStringToByteArray(signature);
        var v = bytes[2 * COMPONENT_LENGTH];
        if (v < V_OFFSET) {
            v += V_OFFSET;
        }
        if (v != V_OFFSET && v != V_OFFSET + 1) {
            throw new MalformedSignatureException("Signature recovery id out of range");
        }
        return new Sign.SignatureData(
                v,
                Arrays.copyOfRange(bytes, 0, COMPONENT_LENGTH),
                Arrays.copyOfRange(bytes, COMPONENT_LENGTH, 2 * COMPONENT_LENGTH));
    }

    private static String toHex(Sign.SignatureData signatureData) {
        var bytes = new byte[2 * COMPONENT_LENGTH + 1];
        System.arraycopy(signatureData.getR(), 0, bytes, 0, COMPONENT_LENGTH);
        System.arraycopy(signatureData.getS(), 0, bytes, COMPONENT_LENGTH, COMPONENT_LENGTH);
        bytes[2 * COMPONENT_LENGTH] = signatureData.getV()[0];
        return Numeric.toHexString(bytes);
    }
}
