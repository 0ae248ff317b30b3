package io.huskytests.core.engine;

import io.huskytests.core.filter.ExternalFilterParser;
import io.huskytests.core.filter.TestFilter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class XmlDiagnosticDumpTest {

    @TempDir
    Path tempDir;

    @Test
    void escapesFilterText() {
        XmlDiagnosticDump dump = new XmlDiagnosticDump();

        dump.dumpExternalFilter(TestFilter.of(ExternalFilterParser.parse("Category=A&Priority=1")), "p");

        assertEquals("<ExternalFilter phase=\"p\">Category=A&amp;Priority=1</ExternalFilter>\n", dump.contents());
    }

    @Test
    void writesNamedDumpFile() throws Exception {
        XmlDiagnosticDump dump = new XmlDiagnosticDump();
        dump.addString("hello");

        Path written = dump.writeTo(tempDir.resolve("out"), "Calc.Tests.dll");

        assertEquals(tempDir.resolve("out").resolve("D_Calc.Tests.dll.dump"), written);
        assertEquals("hello", Files.readString(written));
    }
}
