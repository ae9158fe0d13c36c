package org.ecschema.rdf.common.instance;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Value of a point3d property.
 */
@Value
@JsonPropertyOrder({"x", "y", "z"})
public class Point3d {
    double x;
    double y;
    double z;
}
