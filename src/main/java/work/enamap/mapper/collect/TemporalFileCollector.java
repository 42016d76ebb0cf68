package work.enamap.mapper.collect;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.enamap.mapper.catalog.CatalogFileRecord;
import work.enamap.mapper.catalog.KernelCatalog;
import work.enamap.mapper.catalog.KernelCategory;
import work.enamap.mapper.catalog.KernelWindow;
import work.enamap.mapper.catalog.ScienceCatalog;
import work.enamap.mapper.descriptor.Instrument;
import work.enamap.mapper.descriptor.MapDescriptor;
import work.enamap.mapper.descriptor.ReferenceFrame;
import work.enamap.mapper.descriptor.Sensor;
import work.enamap.mapper.descriptor.SurvivalCorrection;
import work.enamap.mapper.period.TimeWindow;
import work.enamap.mapper.shared.CatalogDates;

/**
 * Selects the catalog files a map generation needs for one window.
 *
 * <p>Pointing sets keep the highest version per start date. Ancillary files keep, per logical tag, the latest start
 * date not after the window end, ties going to the highest version. Kernels are kept when their validity overlaps the
 * window. Catalog failures propagate unchanged.</p>
 */
public final class TemporalFileCollector {
    private static final Logger LOG = LoggerFactory.getLogger(TemporalFileCollector.class);

    static final String POINTING_LEVEL = "l1c";
    static final String SURVIVAL_INSTRUMENT = "glows";
    static final String SURVIVAL_LEVEL = "l3e";

    private final ScienceCatalog scienceCatalog;
    private final KernelCatalog kernelCatalog;

    public TemporalFileCollector(ScienceCatalog scienceCatalog, KernelCatalog kernelCatalog) {
        this.scienceCatalog = Objects.requireNonNull(scienceCatalog, "scienceCatalog");
        this.kernelCatalog = Objects.requireNonNull(kernelCatalog, "kernelCatalog");
    }

    /**
     * Pointing set file names for the descriptor's instrument and sensor, followed by survival-probability files when
     * the descriptor is survival corrected. An empty list means nothing is available.
     */
    public List<String> pointingInputs(MapDescriptor descriptor, TimeWindow window) {
        List<String> tags = pointingTags(descriptor);
        if (tags.isEmpty()) {
            throw new IllegalStateException("No pointing set descriptor for " + descriptor);
        }
        String start = CatalogDates.compact(window.start());
        String end = CatalogDates.compact(window.end());
        String instrument = descriptor.instrument().catalogName();

        List<String> files = new ArrayList<>();
        for (String tag : tags) {
            files.addAll(fileNames(highestVersionPerDate(scienceCatalog.query(instrument, POINTING_LEVEL, tag, start, end))));
        }
        if (files.isEmpty()) {
            return files;
        }
        if (descriptor.survivalCorrection() == SurvivalCorrection.SP) {
            for (String tag : survivalTags(descriptor)) {
                files.addAll(fileNames(highestVersionPerDate(
                    scienceCatalog.query(SURVIVAL_INSTRUMENT, SURVIVAL_LEVEL, tag, start, end)
                )));
            }
        }
        return files;
    }

    public List<String> ancillaryInputs(MapDescriptor descriptor, Instant endDate) {
        List<CatalogFileRecord> records = scienceCatalog.queryAncillary(descriptor.instrument().catalogName());
        Map<String, CatalogFileRecord> nearest = new LinkedHashMap<>();
        for (CatalogFileRecord record : records) {
            if (descriptor.instrument() == Instrument.HI && !matchesSensor(record.descriptorTag(), descriptor.sensor())) {
                continue;
            }
            Instant recordStart = CatalogDates.startOfDay(CatalogDates.parseCompact(record.startDate()));
            if (recordStart.isAfter(endDate)) {
                nearest.putIfAbsent(record.descriptorTag(), null);
                continue;
            }
            CatalogFileRecord current = nearest.get(record.descriptorTag());
            if (current == null || isNewer(record, current)) {
                nearest.put(record.descriptorTag(), record);
            }
        }
        List<String> files = new ArrayList<>();
        for (CatalogFileRecord record : nearest.values()) {
            if (record != null) {
                files.add(record.fileName());
            }
        }
        return files;
    }

    /**
     * Overlapping kernels, grouped by category in load order and by catalog order within a category.
     */
    public List<KernelWindow> kernelWindows(Instant start, Instant end) {
        List<KernelWindow> selected = new ArrayList<>();
        for (KernelCategory category : KernelCategory.values()) {
            for (KernelWindow kernel : kernelCatalog.windows(category)) {
                if (kernel.overlaps(start, end)) {
                    selected.add(kernel);
                }
            }
        }
        LOG.debug("Selected {} kernels for {} to {}", selected.size(), start, end);
        return selected;
    }

    static List<String> pointingTags(MapDescriptor descriptor) {
        List<String> tags = new ArrayList<>();
        switch (descriptor.instrument()) {
            case HI:
                for (String half : sensorHalves(descriptor.sensor())) {
                    tags.add(half + "sensor-pset");
                }
                break;
            case LO:
                tags.add("pset");
                break;
            case ULTRA:
                String kind = descriptor.frame() == ReferenceFrame.SPACECRAFT ? "spacecraftpset" : "heliopset";
                for (String half : sensorHalves(descriptor.sensor())) {
                    tags.add(half + "sensor-" + kind);
                }
                break;
            default:
                break;
        }
        return tags;
    }

    static List<String> survivalTags(MapDescriptor descriptor) {
        List<String> tags = new ArrayList<>();
        switch (descriptor.instrument()) {
            case HI:
                for (String half : sensorHalves(descriptor.sensor())) {
                    tags.add("survival-probability-hi-" + half);
                }
                break;
            case LO:
                tags.add("survival-probability-lo");
                break;
            case ULTRA:
                tags.add("survival-probability-ul");
                break;
            default:
                break;
        }
        return tags;
    }

    /**
     * Keeps the highest version per start date, in order of first appearance of each date.
     */
    static Collection<CatalogFileRecord> highestVersionPerDate(List<CatalogFileRecord> records) {
        Map<String, CatalogFileRecord> byDate = new LinkedHashMap<>();
        for (CatalogFileRecord record : records) {
            CatalogFileRecord current = byDate.get(record.startDate());
            if (current == null || record.versionNumber() > current.versionNumber()) {
                byDate.put(record.startDate(), record);
            }
        }
        return byDate.values();
    }

    private static boolean isNewer(CatalogFileRecord candidate, CatalogFileRecord current) {
        int byDate = CatalogDates.parseCompact(candidate.startDate()).compareTo(CatalogDates.parseCompact(current.startDate()));
        return byDate > 0 || (byDate == 0 && candidate.versionNumber() > current.versionNumber());
    }

    private static boolean matchesSensor(String tag, Sensor sensor) {
        for (String half : sensorHalves(sensor)) {
            if (tag.startsWith(half + "sensor")) {
                return true;
            }
        }
        return false;
    }

    private static List<String> sensorHalves(Sensor sensor) {
        List<String> halves = new ArrayList<>(2);
        if (sensor == Sensor.SENSOR_45 || sensor == Sensor.COMBINED) {
            halves.add(Sensor.SENSOR_45.token());
        }
        if (sensor == Sensor.SENSOR_90 || sensor == Sensor.COMBINED) {
            halves.add(Sensor.SENSOR_90.token());
        }
        return halves;
    }

    private static List<String> fileNames(Collection<CatalogFileRecord> records) {
        List<String> names = new ArrayList<>(records.size());
        for (CatalogFileRecord record : records) {
            names.add(record.fileName());
        }
        return names;
    }
}
