package shaderir.ir;

/**
 * Storage class of a variable. Each category has its own index domain.
 */
public enum VariableCategory {
	UNIFORM,
	ATTRIBUTE,
	VARYING,
	LOCAL
}
