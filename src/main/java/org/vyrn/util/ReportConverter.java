// File: src/main/java/org/vyrn/util/ReportConverter.java
package org.vyrn.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.vyrn.dto.DiagnosticDTO;
import org.vyrn.dto.ExecutionDTO;
import org.vyrn.dto.SymbolDTO;
import org.vyrn.dto.TranslationReportDTO;
import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.translate.TranslationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReportConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static TranslationReportDTO toReport(TranslationResult result, Path source, Path output)
	{
		TranslationReportDTO dto = new TranslationReportDTO();
		dto.source = source != null ? source.toString() : null;
		dto.output = output != null ? output.toString() : null;
		dto.success = !result.hasErrors();
		dto.code = result.getCode();

		for (Diagnostic d : result.getDiagnostics())
		{
			dto.diagnostics.add(diagnosticToDTO(d));
		}
		result.getSymbols().values().forEach(entry -> dto.symbols.add(symbolToDTO(entry)));
		return dto;
	}

	private static DiagnosticDTO diagnosticToDTO(Diagnostic d)
	{
		DiagnosticDTO dto = new DiagnosticDTO();
		dto.kind = d.getKind().name();
		dto.message = d.getMessage();
		dto.line = d.getLine();
		dto.column = d.getColumn();
		dto.statement = d.getStatementIndex();
		return dto;
	}

	private static SymbolDTO symbolToDTO(SymbolEntry entry)
	{
		SymbolDTO dto = new SymbolDTO();
		dto.name = entry.getName();
		dto.type = entry.getType().getName();
		dto.kind = entry.getKind().getDescription();
		dto.value = entry.getValue();
		dto.constantValue = entry.getConstantValue();
		dto.isReference = entry.isReference();
		return dto;
	}

	/**
	 * @param stage Either "compile" or "run", whichever step produced {@code result}.
	 */
	public static ExecutionDTO executionToDTO(String stage, ProcessResult result)
	{
		ExecutionDTO dto = new ExecutionDTO();
		dto.stage = stage;
		dto.exitCode = result.getExitCode();
		dto.timedOut = result.isTimedOut();
		dto.stdout = result.getStdout();
		dto.stderr = result.getStderr();
		return dto;
	}

	public static String toJson(TranslationReportDTO report)
	{
		return GSON.toJson(report);
	}

	public static TranslationReportDTO fromJson(String json)
	{
		return GSON.fromJson(json, TranslationReportDTO.class);
	}

	public static void writeReport(TranslationReportDTO report, Path reportPath) throws IOException
	{
		if (reportPath.toAbsolutePath().getParent() != null)
		{
			Files.createDirectories(reportPath.toAbsolutePath().getParent());
		}
		Files.writeString(reportPath, toJson(report), StandardCharsets.UTF_8);
		Debug.logDebug("Report written to " + reportPath);
	}
}
