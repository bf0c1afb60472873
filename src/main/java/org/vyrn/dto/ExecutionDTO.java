package org.vyrn.dto;

public class ExecutionDTO
{
	public String stage;
	public int exitCode;
	public boolean timedOut = false;
	public String stdout;
	public String stderr;
}
