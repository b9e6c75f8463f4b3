package com.stamp.analysis.datasource;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** FitsContainer backed by the nom-tam-fits library. */
public class NomTamFitsContainer implements FitsContainer {

    private final Fits fits;

    private final Header primaryHeader;

    private final List<FitsTable> tables;

    private NomTamFitsContainer (Fits fits, Header primaryHeader, List<FitsTable> tables) {
        this.fits = fits;
        this.primaryHeader = primaryHeader;
        this.tables = tables;
    }

    public static NomTamFitsContainer open (File file) throws IOException, FitsException {
        Fits fits = new Fits(file);
        try {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length == 0) {
                throw new FitsException("File contains no header-data units.");
            }
            List<FitsTable> tables = new ArrayList<>();
            for (BasicHDU<?> hdu : hdus) {
                if (hdu instanceof BinaryTableHDU) {
                    tables.add(new BinaryTable((BinaryTableHDU) hdu));
                }
            }
            return new NomTamFitsContainer(fits, hdus[0].getHeader(), tables);
        } catch (FitsException | RuntimeException e) {
            fits.close();
            throw e;
        }
    }

    @Override
    public String primaryHeader (String key) {
        return headerValue(primaryHeader, key);
    }

    @Override
    public List<FitsTable> tables () {
        return tables;
    }

    @Override
    public void close () throws IOException {
        fits.close();
    }

    private static String headerValue (Header header, String key) {
        HeaderCard card = header.findCard(key);
        if (card == null) return null;
        String value = card.getValue();
        return value == null ? null : value.trim();
    }

    private static class BinaryTable implements FitsTable {

        private final BinaryTableHDU hdu;

        private final List<String> columnNames;

        BinaryTable (BinaryTableHDU hdu) {
            this.hdu = hdu;
            this.columnNames = new ArrayList<>();
            for (int c = 0; c < hdu.getNCols(); c++) {
                String name = hdu.getColumnName(c);
                columnNames.add(name == null ? "" : name.trim());
            }
        }

        @Override
        public String extName () {
            return headerValue(hdu.getHeader(), "EXTNAME");
        }

        @Override
        public int extVersion () {
            return hdu.getHeader().getIntValue("EXTVER", 1);
        }

        @Override
        public int nRows () {
            return hdu.getNRows();
        }

        @Override
        public List<String> columnNames () {
            return columnNames;
        }

        @Override
        public String header (String key) {
            return headerValue(hdu.getHeader(), key);
        }

        @Override
        public double[] cell (String column, int row) throws FitsException {
            int index = columnNames.indexOf(column);
            if (index < 0) {
                throw new IllegalArgumentException("No column named " + column);
            }
            return ArrayConversions.toDoubleArray(hdu.getElement(row, index));
        }
    }

}
