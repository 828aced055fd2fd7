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
package net.boyechko.uslm.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.boyechko.uslm.UslmTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.w3c.dom.Element;

public class TextExtractorTest extends UslmTestBase {

    @Test
    void prefersContentChild() {
        Element sec =
                element(
                        "<section><num>§ 1.</num><heading>Tax</heading>"
                                + "<content>  A tax is\n   imposed.  </content>"
                                + "<chapeau>ignored</chapeau></section>");
        assertEquals("A tax is imposed.", TextExtractor.extract(sec));
    }

    @Test
    void skipsMetadataAndStructuralChildrenWithoutContent() {
        Element sec =
                element(
                        "<section><num>§ 2.</num><heading>Heading</heading>"
                                + "<chapeau>For purposes of this section</chapeau>"
                                + "<subsection><num>(a)</num><content>nested</content></subsection>"
                                + "<continuation>and so on.</continuation></section>");
        assertEquals("For purposes of this section and so on.", TextExtractor.extract(sec));
    }

    @Test
    void keepsLeadingTextOfElement() {
        Element sec = element("<section>Loose text <num>1</num></section>");
        assertEquals("Loose text", TextExtractor.extract(sec));
    }

    @Test
    void pureContainerHasNoText() {
        Element chapter =
                element(
                        "<chapter><num>CHAPTER 1—</num><heading>Normal taxes</heading>"
                                + "<section><num>§ 1.</num></section></chapter>");
        assertEquals("", TextExtractor.extract(chapter));
    }

    @Test
    void rendersTablesInsideContent() {
        Element sub =
                element(
                        "<subsection><content>Rates: <xhtml:table>"
                                + "<xhtml:tr><xhtml:th>Income</xhtml:th><xhtml:th>Rate</xhtml:th>"
                                + "</xhtml:tr><xhtml:tr><xhtml:td>$0</xhtml:td>"
                                + "<xhtml:td>10%</xhtml:td></xhtml:tr></xhtml:table>"
                                + " Adjusted yearly.</content></subsection>");

        String text = TextExtractor.extract(sub);

        assertEquals(
                "Rates: | Income | Rate | | --- | --- | | $0 | 10% | Adjusted yearly.", text);
    }

    @Test
    void elementToTextKeepsTableLines() {
        Element content =
                element(
                        "<content>Before <xhtml:table><xhtml:tr><xhtml:td>a</xhtml:td>"
                                + "</xhtml:tr></xhtml:table> after</content>");

        String raw = TextExtractor.elementToText(content);

        assertTrue(raw.startsWith("Before \n| a |\n| --- |"), raw);
        assertTrue(raw.endsWith("after"), raw);
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = ';',
            value = {
                "'  a \t b   c  '; 'a b c'",
                "'fees &amp; costs'; 'fees & costs'",
                "'&sect; 1&nbsp;and more'; '§ 1 and more'",
                "''; ''"
            })
    void normalizesEntitiesAndWhitespace(String input, String expected) {
        assertEquals(expected, TextExtractor.normalize(input));
    }

    @Test
    void collapsesNewlines() {
        assertEquals("line one line two", TextExtractor.normalize("line one\n\n  line two\n"));
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = ';',
            value = {
                "'  a \t b   c  '",
                "'fees &amp; costs\n\n and  more'",
                "'&sect; 1&nbsp;&nbsp;and more'",
                "'already normal'",
                "'   '"
            })
    void normalizingTwiceChangesNothing(String input) {
        String once = TextExtractor.normalize(input);
        assertEquals(once, TextExtractor.normalize(once));
    }

    @Test
    void normalizeOfNullIsEmpty() {
        assertEquals("", TextExtractor.normalize(null));
    }
}
