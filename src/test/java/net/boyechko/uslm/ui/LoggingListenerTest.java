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
package net.boyechko.uslm.ui;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.uslm.UslmTestBase;
import net.boyechko.uslm.core.ParsingService;
import net.boyechko.uslm.issue.Issue;
import net.boyechko.uslm.issue.IssueSev;
import net.boyechko.uslm.issue.IssueType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class LoggingListenerTest extends UslmTestBase {
    private Logger parsingLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        parsingLogger = (Logger) LoggerFactory.getLogger("net.boyechko.uslm.parsing");
        parsingLogger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        parsingLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        parsingLogger.detachAppender(appender);
        parsingLogger.setLevel(null);
    }

    private List<String> messages() {
        return appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
    }

    @Test
    void routesParseEventsThroughSlf4j() throws Exception {
        new ParsingService.ParsingServiceBuilder()
                .withListener(new LoggingListener())
                .build()
                .parseDocument(sampleDocument());

        assertTrue(messages().contains("PHASE Building tree"), messages().toString());
        assertTrue(messages().contains("OK Parsed 10 nodes (4 sections)"), messages().toString());
        assertTrue(
                messages().contains("SUMMARY nodes=10 sections=4 repealed=1 issues=0"),
                messages().toString());
    }

    @Test
    void mapsIssueSeverityToLogLevel() {
        LoggingListener listener = new LoggingListener();

        listener.onWarning(new Issue(IssueType.DUPLICATE_CITATION, IssueSev.WARNING, "dup"));
        listener.onWarning(new Issue(IssueType.MISSING_ROOT_ELEMENT, IssueSev.FATAL, "no title"));
        listener.onVerboseOutput("detail");

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals("ISSUE DUPLICATE_CITATION: dup", appender.list.get(0).getFormattedMessage());
        assertEquals(Level.ERROR, appender.list.get(1).getLevel());
        assertEquals(Level.DEBUG, appender.list.get(2).getLevel());
    }

    @Test
    void duplicateCitationIsWarnedOnce() throws Exception {
        Logger projectLogger = (Logger) LoggerFactory.getLogger("net.boyechko.uslm");
        ListAppender<ILoggingEvent> all = new ListAppender<>();
        all.start();
        projectLogger.addAppender(all);
        try {
            new ParsingService.ParsingServiceBuilder()
                    .withListener(new LoggingListener())
                    .build()
                    .parseElement(
                            element(
                                    "<chapter>"
                                            + section("/us/usc/t26/s5", "§ 5.", "First", "")
                                            + section("/us/usc/t26/s5", "§ 5.", "Second", "")
                                            + "</chapter>"));
        } finally {
            projectLogger.detachAppender(all);
        }

        List<ILoggingEvent> warnings =
                all.list.stream()
                        .filter(event -> event.getLevel() == Level.WARN)
                        .collect(Collectors.toList());
        assertEquals(1, warnings.size(), warnings.toString());
        assertTrue(warnings.get(0).getFormattedMessage().startsWith("ISSUE DUPLICATE_CITATION"));
    }

    @Test
    void consoleOutputIsInstalledOnce() {
        LoggingListener.withConsoleOutput();
        LoggingListener.withConsoleOutput();

        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        long consoles = 0;
        for (var it = root.iteratorForAppenders(); it.hasNext(); ) {
            if ("USLM_CONSOLE".equals(it.next().getName())) consoles++;
        }
        assertEquals(1, consoles);
    }
}
