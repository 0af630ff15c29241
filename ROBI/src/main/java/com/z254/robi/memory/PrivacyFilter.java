package com.z254.robi.memory;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keyword gate applied to memory content before it is written.
 * Matching is a case-insensitive substring test, so it over-blocks on purpose
 * ("pin" also rejects "pintar").
 */
@Component
public class PrivacyFilter {

    static final List<String> SENSITIVE_KEYWORDS = List.of(
            // credentials and identifiers
            "contraseña", "password", "clave", "pin",
            "tarjeta", "crédito", "débito", "cuenta bancaria",
            "dni", "pasaporte", "número de seguridad", "seguridad social",
            "dirección", "domicilio",
            // health
            "medicamento", "diagnóstico", "enfermedad", "tratamiento",
            // english
            "address", "passport", "credit card", "debit card", "bank account",
            "social security", "medication", "diagnosis");

    public boolean isPrivate(String content) {
        return matchedKeyword(content).isPresent();
    }

    /**
     * First sensitive keyword found in the content, if any.
     */
    public Optional<String> matchedKeyword(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYWORDS.stream().filter(lower::contains).findFirst();
    }
}
