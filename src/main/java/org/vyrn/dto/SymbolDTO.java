package org.vyrn.dto;

public class SymbolDTO
{
	public String name;
	public String type;
	public String kind;
	public String value;
	public Double constantValue;
	public boolean isReference = false;
}
