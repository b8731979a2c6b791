/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.ticketproof.service;

import ch.admin.bj.swiyu.ticketproof.common.exception.ProofError;
import ch.admin.bj.swiyu.ticketproof.common.exception.ProofException;
import ch.admin.bj.swiyu.ticketproof.domain.proof.DomainParameters;
import ch.admin.bj.swiyu.ticketproof.domain.proof.ProofPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.crypto.WalletUtils;

import java.io.IOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical EIP-712 representation of a ticket proof.
 * <p>
 * The field names of the {@value #PRIMARY_TYPE} struct are part of the wire format and shared with
 * wallets and scanners signing or checking proofs on their own.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class ProofCodec {

    public static final String PRIMARY_TYPE = "TicketProof";
    private static final int UINT256_BITS = 256;

    private static final Map<String, List<Map<String, String>>> TYPES = Map.of(
            "EIP712Domain", List.of(
                    field("name", "string"),
                    field("version", "string"),
                    field("chainId", "uint256"),
                    field("verifyingContract", "address")),
            PRIMARY_TYPE, List.of(
                    field("tokenId", "uint256"),
                    field("owner", "address"),
                    field("timestamp", "uint256"),
                    field("nonce", "uint256")));

    private final ObjectMapper objectMapper;

    /**
     * Renders the proof as EIP-712 typed data document, as passed to eth_signTypedData_v4.
     *
     * @throws ProofException with MALFORMED_INPUT if the payload does not fit the schema
     */
    public String toTypedData(DomainParameters domain, ProofPayload payload) {
        validate(payload);

        var domainValues = new LinkedHashMap<String, Object>();
        domainValues.put("name", domain.protocolName());
        domainValues.put("version", domain.version());
        domainValues.put("chainId", domain.chainId());
        domainValues.put("verifyingContract", domain.verifyingContract());

        var message = new LinkedHashMap<String, Object>();
        message.put("tokenId", payload.entitlementId().toString());
        message.put("owner", payload.owner());
        message.put("timestamp", payload.issuedAt());
        message.put("nonce", payload.nonce().toString());

        var typedData = new LinkedHashMap<String, Object>();
        typedData.put("types", TYPES);
        typedData.put("primaryType", PRIMARY_TYPE);
        typedData.put("domain", domainValues);
        typedData.put("message", message);

        try {
            return objectMapper.writeValueAsString(typedData);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Typed data of ticket proof could not be serialized", e);
        }
    }

    /**
     * @return the 32 byte EIP-712 digest which is signed
     */
    public byte[] hash(DomainParameters domain, ProofPayload payload) {
        var typedData = toTypedData(domain, payload);
        try {
            return new StructuredDataEncoder(typedData).hashStructuredData();
        } catch (IOException | RuntimeException e) {
            throw new ProofException(e, ProofError.MALFORMED_INPUT, "Ticket proof can not be encoded");
        }
    }

    /**
     * Checks the payload against the value ranges of the {@value #PRIMARY_TYPE} struct.
     */
    public void validate(ProofPayload payload) {
        if (payload == null) {
            throw ProofException.malformedInput("Proof payload is missing");
        }
        if (!isUint256(payload.entitlementId())) {
            throw ProofException.malformedInput("Entitlement id must be an unsigned 256 bit integer");
        }
        if (!isUint256(payload.nonce())) {
            throw ProofException.malformedInput("Nonce must be an unsigned 256 bit integer");
        }
        if (payload.issuedAt() < 0) {
            throw ProofException.malformedInput("Issuance timestamp must not be negative");
        }
        if (!isAddress(payload.owner())) {
            throw ProofException.malformedInput("Owner must be a 0x prefixed 20 byte address");
        }
    }

    public static boolean isAddress(String address) {
        return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
    }

    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.bitLength() <= UINT256_BITS;
    }

    private static Map<String, String> field(String name, String type) {
        var field = new LinkedHashMap<String, String>();
        field.put("name", name);
        field.put("type", type);
        return field;
    }
}
