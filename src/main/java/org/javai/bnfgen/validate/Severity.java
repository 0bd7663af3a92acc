package org.javai.bnfgen.validate;

public enum Severity {
	ERROR,
	WARNING
}
