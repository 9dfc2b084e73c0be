package gpusync.hir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Repository of the compiler intrinsics that carry synchronization and
 * memory-access meaning in the kernel IR, with builders for the calls the
 * synchronization pass emits.
 */
public class KernelIntrinsics
{
  /** Barrier among the threads sharing the named storage scope. */
  public static final String STORAGE_SYNC = "storage_sync";

  /** Pointer to a buffer region: {@code access_ptr(buf, offset, extent, mask)}. */
  public static final String ACCESS_PTR = "access_ptr";

  /** Address of a buffer element: {@code address_of(buf[index])}. */
  public static final String ADDRESS_OF = "address_of";

  /** Host-side setup of the cross-block barrier state. */
  public static final String PREPARE_GLOBAL_BARRIER = "prepare_global_barrier";

  /** Device-side initialization of the cross-block barrier state. */
  public static final String GLOBAL_BARRIER_KINIT = "global_barrier_kinit";

  /** {@link #ACCESS_PTR} mask bit: the region is read. */
  public static final int ACCESS_READ = 1;

  /** {@link #ACCESS_PTR} mask bit: the region is written. */
  public static final int ACCESS_WRITE = 2;

  /** Only a single object is constructed. */
  private static final KernelIntrinsics lib = new KernelIntrinsics();

  /** Expected argument count of each intrinsic, -1 if variable. */
  private Map<String, Integer> catalog;

  private KernelIntrinsics()
  {
    catalog = new HashMap<String, Integer>();
    catalog.put(STORAGE_SYNC, -1);
    catalog.put(ACCESS_PTR, 3);
    catalog.put(ADDRESS_OF, 1);
    catalog.put(PREPARE_GLOBAL_BARRIER, 0);
    catalog.put(GLOBAL_BARRIER_KINIT, 0);
  }

  /**
  * Checks if the call has the argument count its intrinsic requires.
  */
  public static boolean isWellFormed(FunctionCall fcall)
  {
    Integer count = lib.catalog.get(fcall.getName());
    if ( count == null )
      return false;
    if ( fcall.getName().equals(STORAGE_SYNC) )
      return fcall.getNumArguments() == 1 || fcall.getNumArguments() == 3;
    if ( fcall.getName().equals(ACCESS_PTR) && fcall.getBufferArgument() == null )
      return false;
    if ( fcall.getName().equals(ADDRESS_OF) && (fcall.getNumArguments() != 1
        || !(fcall.getArgument(0) instanceof BufferLoad)) )
      return false;
    return count.intValue() == fcall.getNumArguments();
  }

  /**
  * Returns {@code storage_sync("scope")}, a barrier among the threads that
  * share the scope.
  */
  public static ExpressionStatement storageSync(StorageScope scope)
  {
    List<Expression> args = new ArrayList<Expression>(1);
    args.add(new StringLiteral(scope.toString()));
    return new ExpressionStatement(new FunctionCall(STORAGE_SYNC, args));
  }

  /**
  * Returns {@code storage_sync("global", is_lead, num_blocks)}, a barrier
  * among all threads of the launch.
  */
  public static ExpressionStatement globalSync(StorageScope scope,
      Expression isLead, Expression numBlocks)
  {
    List<Expression> args = new ArrayList<Expression>(3);
    args.add(new StringLiteral(scope.toString()));
    args.add(isLead);
    args.add(numBlocks);
    return new ExpressionStatement(new FunctionCall(STORAGE_SYNC, args));
  }

  /** Returns a call statement to an intrinsic without arguments. */
  public static ExpressionStatement call(String name)
  {
    return new ExpressionStatement(
        new FunctionCall(name, new ArrayList<Expression>(0)));
  }

  /**
  * Returns {@code access_ptr(buffer, offset, extent, mask)}.
  *
  * @param mask a combination of {@link #ACCESS_READ} and {@link #ACCESS_WRITE}.
  */
  public static FunctionCall accessPtr(Buffer buffer, Expression offset,
      Expression extent, int mask)
  {
    List<Expression> args = new ArrayList<Expression>(3);
    args.add(offset);
    args.add(extent);
    args.add(new IntegerLiteral(mask));
    return new FunctionCall(ACCESS_PTR, buffer, args);
  }

  /**
  * Returns {@code address_of(buffer[index])}.
  */
  public static FunctionCall addressOf(Buffer buffer, Expression index)
  {
    List<Expression> args = new ArrayList<Expression>(1);
    args.add(new BufferLoad(buffer, index));
    return new FunctionCall(ADDRESS_OF, args);
  }

  /**
  * Returns the storage scope named by the first argument of a
  * {@link #STORAGE_SYNC} call.
  *
  * @throws IllegalArgumentException if the call is malformed.
  */
  public static StorageScope getSyncScope(FunctionCall fcall)
  {
    if ( !fcall.getName().equals(STORAGE_SYNC) || fcall.getNumArguments() == 0
        || !(fcall.getArgument(0) instanceof StringLiteral) )
      throw new IllegalArgumentException("malformed barrier: " + fcall);
    return StorageScope.parse(((StringLiteral)fcall.getArgument(0)).getValue());
  }
}
