package io.tern.core.migrate;

public enum Direction
{
    UP("up", 1),
    DOWN("down", -1),
    ;

    private final String name;
    private final int delta;

    Direction(String name, int delta)
    {
        this.name = name;
        this.delta = delta;
    }

    public String getName()
    {
        return name;
    }

    /**
     * Change applied to the schema version by one step in this direction.
     */
    public int getDelta()
    {
        return delta;
    }

    @Override
    public String toString()
    {
        return name;
    }
}
