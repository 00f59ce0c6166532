package shaderir.ir;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import shaderir.glsl.GlslGenerator;

/**
 * Root of the IR. Immutable, so one instance may be rendered from several
 * threads at once. {@link #glsl()} calls into {@code shaderir.glsl}, the only
 * place this package depends on the generator.
 */
public final class Program {

	private final ImmutableList<Type> uniforms;
	private final ImmutableList<Type> attributes;
	private final ImmutableList<Type> varyings;
	private final ImmutableList<Func> funcs;

	public Program(List<Type> uniforms, List<Type> attributes, List<Type> varyings, List<Func> funcs) {
		this.uniforms = ImmutableList.copyOf(uniforms);
		this.attributes = ImmutableList.copyOf(attributes);
		this.varyings = ImmutableList.copyOf(varyings);
		this.funcs = ImmutableList.copyOf(funcs);
	}

	public List<Type> getUniforms() {
		return uniforms;
	}

	public List<Type> getAttributes() {
		return attributes;
	}

	public List<Type> getVaryings() {
		return varyings;
	}

	public List<Func> getFuncs() {
		return funcs;
	}

	/**
	 * @return the number of declarations in a global category
	 */
	public int getVariableCount(VariableCategory category) {
		switch (category) {
			case UNIFORM: return uniforms.size();
			case ATTRIBUTE: return attributes.size();
			case VARYING: return varyings.size();
			default: throw new IllegalArgumentException("Not a program-level category: " + category);
		}
	}

	/**
	 * Renders this program as GLSL source.
	 */
	public String glsl() {
		return GlslGenerator.generate(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Program) {
			Program o = (Program) obj;
			return uniforms.equals(o.uniforms)
				&& attributes.equals(o.attributes)
				&& varyings.equals(o.varyings)
				&& funcs.equals(o.funcs);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(uniforms, attributes, varyings, funcs);
	}

	@Override
	public String toString() {
		return "Program(" + uniforms + ", " + attributes + ", " + varyings + ", " + funcs + ")";
	}
}
