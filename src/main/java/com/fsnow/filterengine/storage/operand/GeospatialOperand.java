package com.fsnow.filterengine.storage.operand;

import com.fsnow.filterengine.geo.GeoPoint;
import com.fsnow.filterengine.geo.GeoPoints;
import com.fsnow.filterengine.geo.GeoShape;
import com.fsnow.filterengine.matching.FlattenedDocument;
import com.fsnow.filterengine.matching.MatchContext;
import com.fsnow.filterengine.model.Keyword;

import java.util.Map;
import java.util.Optional;

/**
 * {@code geospatial} conditions: matches the shapes containing the document point.
 */
public class GeospatialOperand extends AbstractGeospatialOperand {

    @Override
    public Keyword getKeyword() {
        return Keyword.GEOSPATIAL;
    }

    @Override
    public void match(FlattenedDocument document, MatchContext context) {
        for (Map.Entry<String, Map<String, OperandEntry<GeoShape>>> field : fields.entrySet()) {
            Optional<GeoPoint> point = GeoPoints.parse(document.get(field.getKey()));
            if (point.isEmpty()) {
                continue;
            }

            for (OperandEntry<GeoShape> entry : field.getValue().values()) {
                if (entry.getOperand().contains(point.get())) {
                    OperandStore.addMatches(entry.getSubfilters(), context);
                }
            }
        }
    }
}
