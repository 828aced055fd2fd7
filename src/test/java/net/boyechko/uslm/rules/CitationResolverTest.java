/*
 * USLM-Tree - Legal Code Hierarchy Parser
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uslm.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CitationResolverTest {
    private final CitationResolver resolver = new CitationResolver();

    @Test
    void subsectionPathYieldsParenthesizedCitation() {
        assertEquals("26 USC 162(a)", resolver.resolve("(a)", "/us/usc/t26/s162/a"));
    }

    @ParameterizedTest
    @CsvSource({
        "/us/usc/t26/stA/ch1/s1, 1",
        "/us/usc/t26/stA/ch1/schB/pt2/spt3/s61/a/1/A, 61(a)(1)(A)",
        "/us/usc/t26/s274/a/3, 274(a)(3)",
        "/us/usc/t26/s1/s, 1(s)",
        "us/usc/t26/s45Q/, 45Q"
    })
    void sectionPartSkipsGroupingSegments(String identifier, String expected) {
        assertEquals(expected, resolver.sectionPartOf(identifier));
    }

    @Test
    void pathWithoutSectionFallsBackToNum() {
        assertEquals("26 USC CHAPTER 1", resolver.resolve("CHAPTER 1", "/us/usc/t26/ch1"));
        assertEquals("26 USC 12", resolver.resolve("Sec. 12.", "/us/usc/t26/stA"));
    }

    @Test
    void foreignPathIsUsedVerbatimWithoutNum() {
        assertEquals("26 USC /uk/acts/x", resolver.resolve(null, "/uk/acts/x"));
        assertNull(resolver.sectionPartOf("/uk/acts/t1/s5"));
    }

    @Test
    void missingIdentifierUsesNumOrUnknown() {
        assertEquals("26 USC 7", resolver.resolve("7", ""));
        assertEquals("26 USC unknown", resolver.resolve(null, null));
    }

    @Test
    void usesConfiguredCodeLabel() {
        CitationResolver title5 = new CitationResolver("5 USC");
        assertEquals("5 USC 552(b)", title5.resolve("(b)", "/us/usc/t5/s552/b"));
    }

    @ParameterizedTest
    @CsvSource({"Sec. 12., 12", "§ 162., 162", "§§ 1, 1", "sec 4, 4", "(a), (a)", "12, 12"})
    void cleansNumLabels(String num, String expected) {
        assertEquals(expected, CitationResolver.cleanNum(num));
    }

    @Test
    void derivesCodeLabelFromTitlePath() {
        assertEquals("26 USC", resolver.codeLabelFor("/us/usc/t26"));
        assertEquals("5 USC", resolver.codeLabelFor("/us/usc/t5/s552"));
        assertNull(resolver.codeLabelFor("/us/usc/ch1"));
        assertNull(resolver.codeLabelFor(""));
        assertNull(resolver.codeLabelFor("/us/stat/t26"));
    }
}
