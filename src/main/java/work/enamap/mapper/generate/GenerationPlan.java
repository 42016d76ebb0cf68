package work.enamap.mapper.generate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.enamap.mapper.dependency.DataLevel;
import work.enamap.mapper.dependency.DependencyResolver;
import work.enamap.mapper.descriptor.MapDescriptor;

/**
 * Every map a top-level map needs, in build order.
 *
 * <p>Steps are ordered by dependency height (base cases first) and, within a height, by depth-first post-order
 * discovery. A map reached along several paths appears once. The last step is always the top-level map.</p>
 */
public final class GenerationPlan {
    private final List<Step> steps;

    private GenerationPlan(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    public static GenerationPlan of(MapDescriptor target) {
        Map<MapDescriptor, Step> discovered = new LinkedHashMap<>();
        visit(target, discovered, new ArrayList<>());
        List<Step> ordered = new ArrayList<>(discovered.values());
        ordered.sort(Comparator.comparingInt(Step::height));
        return new GenerationPlan(ordered);
    }

    public List<Step> steps() {
        return steps;
    }

    public MapDescriptor target() {
        return steps.get(steps.size() - 1).descriptor();
    }

    private static int visit(MapDescriptor descriptor, Map<MapDescriptor, Step> discovered, List<MapDescriptor> path) {
        Step known = discovered.get(descriptor);
        if (known != null) {
            return known.height();
        }
        if (path.contains(descriptor)) {
            throw new IllegalStateException("Dependency cycle through " + descriptor);
        }
        path.add(descriptor);
        List<MapDescriptor> dependencies = DependencyResolver.dependenciesOf(descriptor);
        int height = 0;
        for (MapDescriptor dependency : dependencies) {
            height = Math.max(height, visit(dependency, discovered, path) + 1);
        }
        path.remove(path.size() - 1);
        discovered.put(descriptor, new Step(descriptor, DependencyResolver.tierOf(descriptor), dependencies, height));
        return height;
    }

    /**
     * One map to build. {@code dependencies} keeps the resolver's order.
     */
    public record Step(MapDescriptor descriptor, DataLevel level, List<MapDescriptor> dependencies, int height) {
        public Step {
            dependencies = List.copyOf(dependencies);
        }
    }
}
