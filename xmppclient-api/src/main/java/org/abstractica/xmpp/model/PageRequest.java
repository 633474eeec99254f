package org.abstractica.xmpp.model;

/**
 * Result set paging controls for an archive query.
 *
 * <p>Every component is optional (null when unset). An empty {@code before}
 * requests the last page of the result set.</p>
 *
 * @param max    maximum number of items to return
 * @param before return the page ending before this cursor
 * @param after  return the page starting after this cursor
 * @param index  zero-based index of the first item to return
 */
public record PageRequest(
        Integer max,
        String before,
        String after,
        Integer index
)
{
    public PageRequest
    {
        if (max != null && max < 0)
        {
            throw new IllegalArgumentException("max must be non-negative: " + max);
        }
        if (index != null && index < 0)
        {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
    }

    /**
     * Requests the most recent {@code max} items.
     *
     * @param max page size
     * @return the request
     */
    public static PageRequest latest(int max)
    {
        return new PageRequest(max, "", null, null);
    }

    /**
     * Requests the page preceding a cursor.
     *
     * @param cursor the {@code first} cursor of the current page
     * @param max    page size
     * @return the request
     */
    public static PageRequest before(String cursor, int max)
    {
        return new PageRequest(max, cursor, null, null);
    }

    /**
     * Requests the page following a cursor.
     *
     * @param cursor the {@code last} cursor of the current page
     * @param max    page size
     * @return the request
     */
    public static PageRequest after(String cursor, int max)
    {
        return new PageRequest(max, null, cursor, null);
    }
}
