// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay.units;

import java.util.*;
import org.slf4j.*;
import com.machinezoo.relay.*;
import com.machinezoo.stagean.*;

/*
 * Pipeline is itself a computation unit, so pipelines can be nested, cached, and checkpointed as a whole.
 */
/**
 * Computation unit composed of ordered {@link TaskField}s.
 * Subclasses declare task fields and register them with {@link DeclarationRegistry}.
 * Invocation feeds output of every task to the next one in declaration order.
 * <p>
 * Output of the pipeline depends on how many tasks are flagged with {@link ComputationUnit#IS_OUTPUT}.
 * If none, output of the last task is returned.
 * If exactly one, its output is returned.
 * Otherwise an unmodifiable list of outputs of the flagged tasks is returned in declaration order.
 * <p>
 * Tasks flagged with {@link ComputationUnit#IS_CHECKPOINT} remember their output,
 * which allows {@link #resumeFromCheckpoint()} to rerun only the tasks after the last checkpoint.
 */
@DraftApi("resume from a checkpoint other than the last one")
public abstract class Pipeline extends ComputationUnit {
	private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);
	protected Pipeline(Arguments arguments) {
		super(arguments);
	}
	/**
	 * Gets current units of all tasks in declaration order.
	 */
	@SuppressWarnings("rawtypes")
	public Map<String, ComputationUnit> tasks() {
		var tasks = new LinkedHashMap<String, ComputationUnit>();
		for (TaskField field : collect(TaskField.class).values())
			tasks.put(field.name(), (ComputationUnit)get(field));
		return tasks;
	}
	@Override
	protected Object operation(Object input) {
		var outputs = new ArrayList<Object>();
		var data = input;
		for (var task : tasks().entrySet()) {
			logger.debug("Running task {} of {}.", task.getKey(), getClass().getSimpleName());
			var unit = task.getValue();
			data = unit.invoke(data);
			if (unit.get(IS_OUTPUT))
				outputs.add(data);
		}
		if (outputs.isEmpty())
			return data;
		if (outputs.size() == 1)
			return outputs.get(0);
		return Collections.unmodifiableList(outputs);
	}
	/**
	 * Gets tasks from the last checkpoint to the end of the pipeline.
	 *
	 * @return ordered map of tasks starting with the last checkpoint
	 * @throws IllegalStateException
	 *             if no task is flagged as checkpoint
	 */
	public Map<String, ComputationUnit> checkpointUnits() {
		var tasks = new ArrayList<>(tasks().entrySet());
		for (int start = tasks.size() - 1; start >= 0; --start) {
			if (tasks.get(start).getValue().get(IS_CHECKPOINT)) {
				var units = new LinkedHashMap<String, ComputationUnit>();
				for (var task : tasks.subList(start, tasks.size()))
					units.put(task.getKey(), task.getValue());
				return units;
			}
		}
		throw new IllegalStateException("No checkpoints were defined.");
	}
	/**
	 * Reruns tasks after the last checkpoint, starting with checkpoint data of the checkpoint task.
	 *
	 * @return output of the last task
	 * @throws IllegalStateException
	 *             if there is no checkpoint or the checkpoint task has not been run yet
	 */
	public Object resumeFromCheckpoint() {
		var units = new ArrayList<>(checkpointUnits().values());
		var data = units.get(0).checkpointData();
		if (data == null)
			throw new IllegalStateException("No checkpoint data found, the whole pipeline must be run first for a checkpoint to exist.");
		for (var unit : units.subList(1, units.size()))
			data = unit.invoke(data);
		return data;
	}
	@Override
	public String toString() {
		var description = new StringBuilder(getClass().getSimpleName()).append("(\n");
		for (var task : tasks().entrySet())
			description.append("    ").append(task.getKey()).append(": ").append(task.getValue()).append(",\n");
		return description.append(")").toString();
	}
}
