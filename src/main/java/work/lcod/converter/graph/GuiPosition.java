package work.lcod.converter.graph;

/**
 * Canvas position of a node in the designer.
 */
public record GuiPosition(double x, double y) {}
