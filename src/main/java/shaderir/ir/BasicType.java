package shaderir.ir;

/**
 * The shape tag of a {@link Type}.
 */
public enum BasicType {
	FLOAT("float"),
	VEC2("vec2"),
	VEC3("vec3"),
	VEC4("vec4"),
	MAT2("mat2"),
	MAT3("mat3"),
	MAT4("mat4"),
	/** named by the generator, members are given by {@link Type#getSub()} */
	STRUCT(null);

	private final String glslName;

	BasicType(String glslName) {
		this.glslName = glslName;
	}

	/**
	 * @return the fixed GLSL token, or null for {@link #STRUCT}
	 */
	public String getGlslName() {
		return glslName;
	}

}
