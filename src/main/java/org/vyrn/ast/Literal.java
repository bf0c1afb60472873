package org.vyrn.ast;

/**
 * A value as written in the source.
 * <p>
 * For INT and FLOAT the raw text may be a fully parenthesised arithmetic
 * rendering such as {@code ((1 + 2) * x)}; it is never evaluated here.
 * STRING raw text is the content without the surrounding quotes. When
 * {@code reference} is set the raw text is the name of another variable.
 */
public final class Literal implements AstNode
{
	private final LiteralKind kind;
	private final String rawText;
	private final boolean reference;
	private final Double constantValue;

	private Literal(LiteralKind kind, String rawText, boolean reference, Double constantValue)
	{
		this.kind = kind;
		this.rawText = rawText;
		this.reference = reference;
		this.constantValue = constantValue;
	}

	public Literal(LiteralKind kind, String rawText, boolean reference)
	{
		this(kind, rawText, reference, null);
	}

	public Literal(LiteralKind kind, String rawText)
	{
		this(kind, rawText, false);
	}

	/**
	 * An int or float value together with what it evaluates to, already
	 * converted to the declared type; {@code constantValue} is {@code null}
	 * when the text is not a constant expression.
	 */
	public static Literal numeric(LiteralKind kind, String rawText, Double constantValue)
	{
		return new Literal(kind, rawText, false, constantValue);
	}

	public static Literal ofBool(boolean value)
	{
		return new Literal(LiteralKind.BOOL, value ? "true" : "false");
	}

	public LiteralKind getKind()
	{
		return kind;
	}

	public String getRawText()
	{
		return rawText;
	}

	public boolean isReference()
	{
		return reference;
	}

	public Double getConstantValue()
	{
		return constantValue;
	}

	public boolean asBoolean()
	{
		return kind == LiteralKind.BOOL && rawText.equals("true");
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitLiteral(this);
	}

	@Override
	public String toString()
	{
		return "Literal(" + kind + ", " + rawText + (reference ? ", ref" : "") + ")";
	}
}
