package org.vyrn.dto;

public class DiagnosticDTO
{
	public String kind;
	public String message;
	public int line;
	public int column;
	public int statement;
}
