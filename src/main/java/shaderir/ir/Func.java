package shaderir.ir;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A void function. Parameters take local indices in the order in, inout, out.
 */
public final class Func {

	private final String name;
	private final ImmutableList<Type> inParams;
	private final ImmutableList<Type> inOutParams;
	private final ImmutableList<Type> outParams;
	private final Block block;

	public Func(String name, List<Type> inParams, List<Type> inOutParams, List<Type> outParams, Block block) {
		this.name = Preconditions.checkNotNull(name, "name");
		Preconditions.checkArgument(!name.isEmpty(), "function name must not be empty");
		this.inParams = ImmutableList.copyOf(inParams);
		this.inOutParams = ImmutableList.copyOf(inOutParams);
		this.outParams = ImmutableList.copyOf(outParams);
		this.block = Preconditions.checkNotNull(block, "block");
	}

	public String getName() {
		return name;
	}

	public List<Type> getInParams() {
		return inParams;
	}

	public List<Type> getInOutParams() {
		return inOutParams;
	}

	public List<Type> getOutParams() {
		return outParams;
	}

	public Block getBlock() {
		return block;
	}

	public int getParamCount() {
		return inParams.size() + inOutParams.size() + outParams.size();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Func) {
			Func o = (Func) obj;
			return name.equals(o.name)
				&& inParams.equals(o.inParams)
				&& inOutParams.equals(o.inOutParams)
				&& outParams.equals(o.outParams)
				&& block.equals(o.block);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, inParams, inOutParams, outParams, block);
	}

	@Override
	public String toString() {
		return "Func(" + name + ", " + inParams + ", " + inOutParams + ", " + outParams + ", " + block + ")";
	}
}
