package org.javai.stl.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.function.BiConsumer;
import org.javai.stl.ast.Bound;
import org.javai.stl.ast.Interval;
import org.javai.stl.translate.CompiledSpecification.LinearSpecification;
import org.javai.stl.translate.CompiledSpecification.TreeSpecification;

/**
 * Writes a {@link CompiledSpecification} as JSON for an external monitor.
 *
 * <pre>{@code
 * {
 *   "backend" : "linear-constraint",
 *   "variables" : [ { "name" : "x", "column" : 0, "type" : "float" } ],
 *   "dimension" : 1,
 *   "predicates" : [ { "name" : "x", "coefficients" : [ -1.0 ], "threshold" : -10.0 } ],
 *   "skeleton" : { "operator" : "always", "operands" : [ { "predicate" : 0 } ] }
 * }
 * }</pre>
 *
 * Infinite interval bounds are written as the string {@code "inf"}.
 */
public class CompiledSpecificationWriter {

	private final ObjectMapper mapper;

	public CompiledSpecificationWriter() {
		this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
	}

	public CompiledSpecificationWriter(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	public String write(CompiledSpecification specification) {
		try {
			return mapper.writeValueAsString(toJson(specification));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write compiled specification", e);
		}
	}

	public ObjectNode toJson(CompiledSpecification specification) {
		Objects.requireNonNull(specification, "specification must not be null");
		ObjectNode json = mapper.createObjectNode();
		json.put("backend", specification.backend().label());

		if (specification instanceof LinearSpecification linear) {
			writeVariables(json.putArray("variables"), linear);
			json.put("dimension", linear.dimension());
			ArrayNode predicates = json.putArray("predicates");
			for (LinearPredicate predicate : linear.predicates()) {
				ObjectNode p = predicates.addObject();
				p.put("name", predicate.name());
				ArrayNode row = p.putArray("coefficients");
				for (Double coefficient : predicate.coefficients()) {
					row.add(coefficient.doubleValue());
				}
				p.put("threshold", predicate.threshold());
			}
			json.set("skeleton", treeToJson(linear.skeleton(), (node, index) -> node.put("predicate", index)));
		}
		else if (specification instanceof TreeSpecification tree) {
			writeVariables(json.putArray("declarations"), tree);
			json.set("tree", treeToJson(tree.tree(), this::writeResolved));
		}
		return json;
	}

	private void writeVariables(ArrayNode array, CompiledSpecification specification) {
		for (VariableBinding binding : specification.variables()) {
			ObjectNode v = array.addObject();
			v.put("name", binding.name());
			v.put("column", binding.columnIndex());
			v.put("type", binding.type().label());
		}
	}

	private void writeResolved(ObjectNode node, ResolvedPredicate predicate) {
		node.put("column", predicate.columnIndex());
		node.put("type", predicate.type().label());
		if (!predicate.isBoolean()) {
			node.put("relop", predicate.relop().symbol());
			node.put("threshold", predicate.threshold());
			node.put("negatedName", predicate.negatedName());
		}
	}

	private <L> ObjectNode treeToJson(OperatorTree<L> tree, BiConsumer<ObjectNode, L> leafWriter) {
		ObjectNode json = mapper.createObjectNode();
		if (tree instanceof OperatorTree.Leaf<L> leaf) {
			leafWriter.accept(json, leaf.value());
			return json;
		}
		OperatorTree.Node<L> node = (OperatorTree.Node<L>) tree;
		json.put("operator", node.operator().keyword());
		if (node.interval() != null) {
			json.set("interval", intervalToJson(node.interval()));
		}
		ArrayNode operands = json.putArray("operands");
		for (OperatorTree<L> operand : node.operands()) {
			operands.add(treeToJson(operand, leafWriter));
		}
		return json;
	}

	private ObjectNode intervalToJson(Interval interval) {
		ObjectNode json = mapper.createObjectNode();
		putBound(json, "lower", interval.lower());
		json.put("lowerClosed", interval.lowerClosed());
		putBound(json, "upper", interval.upper());
		json.put("upperClosed", interval.upperClosed());
		return json;
	}

	private static void putBound(ObjectNode json, String field, Bound bound) {
		if (bound instanceof Bound.Finite finite) {
			json.put(field, finite.value());
		}
		else {
			json.put(field, bound.text());
		}
	}
}
