package org.ecschema.rdf.common.instance;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Value of a point2d property.
 */
@Value
@JsonPropertyOrder({"x", "y"})
public class Point2d {
    double x;
    double y;
}
