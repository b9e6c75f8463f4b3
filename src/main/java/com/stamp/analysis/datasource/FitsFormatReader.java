package com.stamp.analysis.datasource;

import com.stamp.cube.CubeAssemblyException;
import com.stamp.cube.Integration;
import com.stamp.cube.SourceFile;
import com.stamp.cube.SourceFormat;
import com.stamp.cube.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.stamp.analysis.datasource.KeyResolver.Field.ERROR;
import static com.stamp.analysis.datasource.KeyResolver.Field.FLUX;
import static com.stamp.analysis.datasource.KeyResolver.Field.TIME;
import static com.stamp.analysis.datasource.KeyResolver.Field.WAVELENGTH;

/**
 * Reads per-integration spectral extractions from FITS files. Integrations are found in one of three layouts,
 * detected in this order:
 * <ol>
 *     <li>a populated EXTRACT1D table with a per-row time column: one integration per row</li>
 *     <li>several EXTRACT1D extensions: integration i comes from the extension with EXTVER i, timed by INT_TIMES row i</li>
 *     <li>a single EXTRACT1D table whose row i is timed by INT_TIMES row i</li>
 * </ol>
 * Both INT_TIMES and EXTRACT1D are required in every layout.
 */
public class FitsFormatReader extends FormatReader {

    private static final Logger LOG = LoggerFactory.getLogger(FitsFormatReader.class);

    public static final String INT_TIMES = "INT_TIMES";
    public static final String EXTRACT1D = "EXTRACT1D";
    public static final String DEFAULT_FLUX_UNIT = "MJy";

    enum Layout {
        ROWS_WITH_TIME, INDIVIDUAL_EXTENSIONS, ROWS_WITH_INT_TIMES
    }

    private final ContainerOpener<FitsContainer> opener;

    public FitsFormatReader (int minValidPoints, ContainerOpener<FitsContainer> opener) {
        super(minValidPoints);
        this.opener = opener;
    }

    @Override
    public SourceFormat format () {
        return SourceFormat.FITS;
    }

    /** The extensions a layout is read from, located once per file. */
    private static class Extensions {
        FitsTable intTimes;
        List<FitsTable> extracts;
        Layout layout;
        /** Resolved INT_TIMES time column; null in the row-time layout. */
        String intTimesColumn;
    }

    private static Extensions locate (FitsContainer fits, String fileName) {
        Extensions ext = new Extensions();
        ext.intTimes = fits.find(INT_TIMES);
        if (ext.intTimes == null) {
            throw CubeAssemblyException.unsupportedStructure(fileName, "no " + INT_TIMES + " extension");
        }
        ext.extracts = fits.findAll(EXTRACT1D);
        if (ext.extracts.isEmpty()) {
            throw CubeAssemblyException.unsupportedStructure(fileName, "no " + EXTRACT1D + " extension");
        }
        FitsTable first = ext.extracts.get(0);
        if (first.nRows() > 0 && KeyResolver.FITS_ROW_TIME.canResolve(first.columnNames())) {
            ext.layout = Layout.ROWS_WITH_TIME;
        } else {
            ext.layout = ext.extracts.size() > 1 ? Layout.INDIVIDUAL_EXTENSIONS : Layout.ROWS_WITH_INT_TIMES;
            ext.intTimesColumn = KeyResolver.FITS_INT_TIMES.resolve(fileName, ext.intTimes.columnNames()).key(TIME);
        }
        return ext;
    }

    @Override
    protected FileProbe probeFile (File file, String fileName) throws Exception {
        try (FitsContainer fits = opener.open(file)) {
            Extensions ext = locate(fits, fileName);
            FitsTable first = ext.extracts.get(0);
            switch (ext.layout) {
                case ROWS_WITH_TIME: {
                    String timeColumn = KeyResolver.FITS_ROW_TIME.resolve(fileName, first.columnNames()).key(TIME);
                    return new FileProbe(first.nRows(), first.scalar(timeColumn, 0));
                }
                case INDIVIDUAL_EXTENSIONS: {
                    int n = Math.min(ext.extracts.size(), ext.intTimes.nRows());
                    return new FileProbe(n, firstIntTime(ext));
                }
                default: {
                    int n = Math.min(first.nRows(), ext.intTimes.nRows());
                    return new FileProbe(n, firstIntTime(ext));
                }
            }
        }
    }

    private static double firstIntTime (Extensions ext) throws Exception {
        return ext.intTimes.nRows() == 0 ? Double.NaN : ext.intTimes.scalar(ext.intTimesColumn, 0);
    }

    @Override
    protected SourceFile readFile (File file, String fileName, ProgressListener progressListener) throws Exception {
        try (FitsContainer fits = opener.open(file)) {
            Extensions ext = locate(fits, fileName);
            LOG.info("{}: reading {} layout with {} {} extension(s).",
                fileName, ext.layout, ext.extracts.size(), EXTRACT1D);
            List<Integration> integrations;
            switch (ext.layout) {
                case ROWS_WITH_TIME:
                    integrations = readRowsWithTime(ext.extracts.get(0), fileName, progressListener);
                    break;
                case INDIVIDUAL_EXTENSIONS:
                    integrations = readIndividualExtensions(fits, ext, fileName, progressListener);
                    break;
                default:
                    integrations = readRowsWithIntTimes(ext, fileName, progressListener);
            }
            return new SourceFile(fileName, SourceFormat.FITS, integrations, headerInfo(fits, ext.extracts.get(0)));
        }
    }

    private List<Integration> readRowsWithTime (FitsTable table, String fileName, ProgressListener progress)
            throws Exception {
        ResolvedKeys keys = KeyResolver.FITS_SPECTRUM.resolve(fileName, table.columnNames());
        String timeColumn = KeyResolver.FITS_ROW_TIME.resolve(fileName, table.columnNames()).key(TIME);
        LOG.debug("{}: using time column {}", fileName, timeColumn);
        List<Integration> integrations = new ArrayList<>();
        for (int row = 0; row < table.nRows(); row++) {
            progress.checkCancelled();
            try {
                Integration integration = sanitize(fileName, row,
                    table.cell(keys.key(WAVELENGTH), row),
                    table.cell(keys.key(FLUX), row),
                    keys.has(ERROR) ? keys.normalizeUnits(ERROR, table.cell(keys.key(ERROR), row)) : null,
                    table.scalar(timeColumn, row));
                if (integration != null) integrations.add(integration);
            } catch (Exception e) {
                LOG.warn("{}: skipping integration {} which could not be read: {}", fileName, row + 1, e.toString());
            }
            progress.increment();
        }
        return integrations;
    }

    private List<Integration> readIndividualExtensions (FitsContainer fits, Extensions ext, String fileName,
                                                        ProgressListener progress) throws Exception {
        List<Integration> integrations = new ArrayList<>();
        int n = ext.intTimes.nRows();
        for (int i = 0; i < n; i++) {
            progress.checkCancelled();
            FitsTable table = fits.find(EXTRACT1D, i + 1);
            if (table == null) {
                LOG.warn("{}: no {} extension with version {}; {} of {} timed integrations found.",
                    fileName, EXTRACT1D, i + 1, i, n);
                break;
            }
            try {
                ResolvedKeys keys = KeyResolver.FITS_SPECTRUM.resolve(fileName, table.columnNames());
                Integration integration = sanitize(fileName, i,
                    table.column(keys.key(WAVELENGTH)),
                    table.column(keys.key(FLUX)),
                    keys.has(ERROR) ? keys.normalizeUnits(ERROR, table.column(keys.key(ERROR))) : null,
                    ext.intTimes.scalar(ext.intTimesColumn, i));
                if (integration != null) integrations.add(integration);
            } catch (Exception e) {
                LOG.warn("{}: skipping integration {} which could not be read: {}", fileName, i + 1, e.toString());
            }
            progress.increment();
        }
        return integrations;
    }

    private List<Integration> readRowsWithIntTimes (Extensions ext, String fileName, ProgressListener progress)
            throws Exception {
        FitsTable table = ext.extracts.get(0);
        ResolvedKeys keys = KeyResolver.FITS_SPECTRUM.resolve(fileName, table.columnNames());
        int nTimes = ext.intTimes.nRows();
        if (nTimes != table.nRows()) {
            LOG.warn("{}: {} has {} rows but {} has {}; only the first {} are used.",
                fileName, EXTRACT1D, table.nRows(), INT_TIMES, nTimes, Math.min(nTimes, table.nRows()));
        }
        int n = Math.min(nTimes, table.nRows());
        List<Integration> integrations = new ArrayList<>();
        for (int row = 0; row < n; row++) {
            progress.checkCancelled();
            try {
                Integration integration = sanitize(fileName, row,
                    table.cell(keys.key(WAVELENGTH), row),
                    table.cell(keys.key(FLUX), row),
                    keys.has(ERROR) ? keys.normalizeUnits(ERROR, table.cell(keys.key(ERROR), row)) : null,
                    ext.intTimes.scalar(ext.intTimesColumn, row));
                if (integration != null) integrations.add(integration);
            } catch (Exception e) {
                LOG.warn("{}: skipping integration {} which could not be read: {}", fileName, row + 1, e.toString());
            }
            progress.increment();
        }
        return integrations;
    }

    /** Best-effort descriptive metadata. Nothing here is required. */
    static Map<String, String> headerInfo (FitsContainer fits, FitsTable extract) {
        Map<String, String> info = new HashMap<>();
        putIfPresent(info, SourceFile.TARGET, fits.primaryHeader("TARGNAME"));
        putIfPresent(info, SourceFile.INSTRUMENT, fits.primaryHeader("INSTRUME"));
        putIfPresent(info, SourceFile.FILTER, fits.primaryHeader("FILTER"));
        putIfPresent(info, SourceFile.GRATING, fits.primaryHeader("GRATING"));
        putIfPresent(info, SourceFile.OBS_DATE, fits.primaryHeader("DATE-OBS"));
        putIfPresent(info, SourceFile.EXPOSURE_TIME, fits.primaryHeader("EXPTIME"));
        info.put(SourceFile.FLUX_UNIT, fluxUnit(fits, extract));
        return info;
    }

    /** BUNIT of the primary header, then of the extraction table, then the unit of its first flux column. */
    static String fluxUnit (FitsContainer fits, FitsTable extract) {
        String unit = fits.primaryHeader("BUNIT");
        if (isBlank(unit)) unit = extract.header("BUNIT");
        if (isBlank(unit)) {
            for (int c = 1; c <= extract.columnNames().size(); c++) {
                String type = extract.header("TTYPE" + c);
                String columnUnit = extract.header("TUNIT" + c);
                if (type != null && type.toLowerCase(Locale.ROOT).contains("flux") && !isBlank(columnUnit)) {
                    unit = columnUnit;
                    break;
                }
            }
        }
        return isBlank(unit) ? DEFAULT_FLUX_UNIT : unit;
    }

    private static void putIfPresent (Map<String, String> info, String key, String value) {
        if (!isBlank(value)) info.put(key, value);
    }

    private static boolean isBlank (String value) {
        return value == null || value.isBlank();
    }

}
