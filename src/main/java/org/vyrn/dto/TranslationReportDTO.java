package org.vyrn.dto;

import java.util.ArrayList;
import java.util.List;

public class TranslationReportDTO
{
	public String source;
	public String output;
	public boolean success;
	public String code;
	public List<DiagnosticDTO> diagnostics = new ArrayList<>();
	public List<SymbolDTO> symbols = new ArrayList<>();
	public ExecutionDTO execution;
}
