package org.vyrn.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vyrn.dto.TranslationReportDTO;
import org.vyrn.translate.Translator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class ReportConverterTest
{
	@TempDir
	Path tempDir;

	@Test
	void convertsTranslationResult()
	{
		TranslationReportDTO report = ReportConverter.toReport(
				new Translator().translate("let int x = 1; const string s = \"a\"; y = 2;"),
				Paths.get("in.vy"), Paths.get("in.cpp"));

		assertEquals("in.vy", report.source);
		assertEquals("in.cpp", report.output);
		assertFalse(report.success);
		assertEquals(1, report.diagnostics.size());
		assertEquals("SEMANTIC_ERROR", report.diagnostics.get(0).kind);
		assertEquals(2, report.diagnostics.get(0).statement);
		assertEquals(2, report.symbols.size());
		assertEquals("s", report.symbols.get(1).name);
		assertEquals("string", report.symbols.get(1).type);
		assertEquals("constant", report.symbols.get(1).kind);
		assertEquals(1.0, report.symbols.get(0).constantValue);
		assertNull(report.symbols.get(1).constantValue);
		assertNull(report.execution);
	}

	@Test
	void jsonUsesFieldNames()
	{
		TranslationReportDTO report = ReportConverter.toReport(new Translator().translate("log(1);"), null, null);
		report.execution = ReportConverter.executionToDTO("run", new ProcessResult(0, "1\n", "", false));

		String json = ReportConverter.toJson(report);

		assertTrue(json.contains("\"success\": true"));
		assertTrue(json.contains("\"stage\": \"run\""));
		assertFalse(json.contains("\"source\""));
	}

	@Test
	void writesReadableReport() throws IOException
	{
		TranslationReportDTO report = ReportConverter.toReport(new Translator().translate("let bool b = !true;"), null, null);
		Path out = tempDir.resolve("reports/r.json");

		ReportConverter.writeReport(report, out);
		TranslationReportDTO read = ReportConverter.fromJson(Files.readString(out));

		assertEquals("bool b = false;\n", read.code);
		assertEquals("false", read.symbols.get(0).value);
		assertNull(read.execution);
	}
}
