package com.stamp.analysis.datasource;

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;

import java.io.File;
import java.lang.reflect.Array;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** HierarchicalContainer backed by the pure-Java jHDF library. */
public class JhdfContainer implements HierarchicalContainer {

    private final HdfFile hdfFile;

    private JhdfContainer (HdfFile hdfFile) {
        this.hdfFile = hdfFile;
    }

    public static JhdfContainer open (File file) {
        return new JhdfContainer(new HdfFile(file.toPath()));
    }

    @Override
    public Set<String> datasetNames () {
        Set<String> names = new LinkedHashSet<>();
        for (Map.Entry<String, Node> entry : hdfFile.getChildren().entrySet()) {
            if (entry.getValue() instanceof Dataset) names.add(entry.getKey());
        }
        return names;
    }

    @Override
    public Object read (String datasetName) {
        return hdfFile.getDatasetByPath(datasetName).getData();
    }

    @Override
    public int[] dimensions (String datasetName) {
        return hdfFile.getDatasetByPath(datasetName).getDimensions();
    }

    @Override
    public String attribute (String name) {
        Attribute attribute = hdfFile.getAttribute(name);
        if (attribute == null) return null;
        Object data = attribute.getData();
        // Scalars may come back as one-element arrays.
        while (data != null && data.getClass().isArray()) {
            data = Array.getLength(data) == 0 ? null : Array.get(data, 0);
        }
        return data == null ? null : data.toString().trim();
    }

    @Override
    public void close () {
        hdfFile.close();
    }

}
