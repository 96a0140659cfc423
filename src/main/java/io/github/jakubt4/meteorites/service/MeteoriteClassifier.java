package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.ClassificationGroup;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

import static io.github.jakubt4.meteorites.model.ClassificationGroup.ACHONDRITE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.CARBONACEOUS;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.ENSTATITE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.H_TYPE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.IRON;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.LL_TYPE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.LUNAR;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.L_TYPE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.MARTIAN;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.MESOSIDERITE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.OTHER;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.PALLASITE;
import static io.github.jakubt4.meteorites.model.ClassificationGroup.UNKNOWN;
import static io.github.jakubt4.meteorites.service.ClassificationRule.exact;
import static io.github.jakubt4.meteorites.service.ClassificationRule.prefix;
import static io.github.jakubt4.meteorites.service.ClassificationRule.typeSymbol;

/**
 * Maps a free-text Meteoritical Bulletin classification ({@code recclass}) to a
 * {@link ClassificationGroup}.
 *
 * <p>Rules are evaluated top to bottom and the first match wins. Ordering matters:
 * <ul>
 *   <li>named groups beginning with L, H or E (Lunar, Lodranite, Howardite, Eucrite)
 *       come before the bare type-letter rules,</li>
 *   <li>{@code LL} comes before {@code L}, otherwise LL chondrites would be L-type,</li>
 *   <li>{@code EH}/{@code EL} come before the bare {@code E} enstatite rule.</li>
 * </ul>
 * The function is total: blank input is {@link ClassificationGroup#UNKNOWN} and
 * anything unmatched is {@link ClassificationGroup#OTHER}.
 */
@Service
public class MeteoriteClassifier {

    static final Set<String> UNKNOWN_TOKENS = Set.of("Unknown", "Stone-uncl", "Chondrite-ung");

    private static final List<ClassificationRule> RULES = List.of(
            prefix("Martian", MARTIAN),
            prefix("Lunar", LUNAR),
            prefix("Pallasite", PALLASITE),
            prefix("Mesosiderite", MESOSIDERITE),
            prefix("Iron", IRON),

            typeSymbol("EH", ENSTATITE),
            typeSymbol("EL", ENSTATITE),

            prefix("Eucrite", ACHONDRITE),
            prefix("Howardite", ACHONDRITE),
            prefix("Diogenite", ACHONDRITE),
            prefix("Aubrite", ACHONDRITE),
            prefix("Ureilite", ACHONDRITE),
            prefix("Angrite", ACHONDRITE),
            prefix("Acapulcoite", ACHONDRITE),
            prefix("Lodranite", ACHONDRITE),
            prefix("Winonaite", ACHONDRITE),
            prefix("Brachinite", ACHONDRITE),
            prefix("Achondrite", ACHONDRITE),

            typeSymbol("E", ENSTATITE),
            typeSymbol("LL", LL_TYPE),
            typeSymbol("L", L_TYPE),
            typeSymbol("H", H_TYPE),
            typeSymbol("C", CARBONACEOUS),

            exact(UNKNOWN_TOKENS, UNKNOWN)
    );

    /**
     * @param classificationRaw classification as published, may be {@code null}
     * @return the group of the first matching rule, never {@code null}
     */
    public ClassificationGroup classify(final String classificationRaw) {
        if (classificationRaw == null || classificationRaw.isBlank()) {
            return UNKNOWN;
        }
        final var value = classificationRaw.trim();
        for (final ClassificationRule rule : RULES) {
            if (rule.matches(value)) {
                return rule.group();
            }
        }
        return OTHER;
    }

    /**
     * The ordered rule table, first entry evaluated first.
     */
    public List<ClassificationRule> rules() {
        return RULES;
    }
}
